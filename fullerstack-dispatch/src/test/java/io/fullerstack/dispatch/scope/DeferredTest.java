package io.fullerstack.dispatch.scope;

import io.fullerstack.dispatch.context.LoopingContext;
import io.fullerstack.dispatch.error.ClosureException;
import io.fullerstack.dispatch.error.JobCancelledException;
import io.fullerstack.dispatch.error.JobTimeoutException;
import io.fullerstack.dispatch.job.JobState;
import io.fullerstack.dispatch.job.Outcome;
import io.fullerstack.dispatch.pool.DispatcherPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class DeferredTest {

  private DispatcherPool pool;
  private LoopingContext main;
  private JobScope       scope;

  @BeforeEach
  void setUp () {
    pool = DispatcherPool.builder ( "deferred-test" ).workers ( 2 ).build ();
    main = LoopingContext.create ( "main" );
    scope = new JobScope ( "test", pool );
  }

  @AfterEach
  void cleanup () {
    scope.teardown ( Duration.ZERO );
    main.close ();
    pool.shutdownNow ();
  }

  @Test
  @Timeout ( 5 )
  void shouldReturnValueFromAwait () {
    Deferred < String > deferred = scope.async ( signal -> "value" );

    assertThat ( deferred.await () ).isEqualTo ( "value" );
    assertThat ( deferred.await () ).isEqualTo ( "value" );
    assertThat ( deferred.isObserved () ).isTrue ();
  }

  @Test
  @DisplayName ( "Awaiting a failed deferred twice rethrows the same cause and never re-runs the work" )
  @Timeout ( 5 )
  void shouldRethrowSameCauseOnEveryAwait () {
    AtomicInteger runs = new AtomicInteger ();
    IOException cause = new IOException ( "disk gone" );
    Deferred < String > deferred = scope.async ( signal -> {
      runs.incrementAndGet ();
      throw cause;
    } );

    Throwable first = catchThrowable ( deferred::await );
    Throwable second = catchThrowable ( deferred::await );

    assertThat ( first ).isInstanceOf ( ClosureException.class );
    assertThat ( first.getCause () ).isSameAs ( cause );
    assertThat ( second ).isInstanceOf ( ClosureException.class );
    assertThat ( second.getCause () ).isSameAs ( cause );
    assertThat ( runs.get () ).isEqualTo ( 1 );
    assertThat ( deferred.state () ).isEqualTo ( JobState.FAILED );
  }

  @Test
  @Timeout ( 5 )
  void shouldRaiseCancellationFromAwait () {
    CountDownLatch release = new CountDownLatch ( 1 );
    Deferred < Boolean > deferred = scope.async ( signal -> release.await ( 5, TimeUnit.SECONDS ) );

    deferred.cancel ();
    release.countDown ();

    assertThatThrownBy ( deferred::await ).isInstanceOf ( JobCancelledException.class );
  }

  @Test
  @Timeout ( 5 )
  void shouldTimeOutBoundedAwaitWithoutCancellingJob () {
    CountDownLatch release = new CountDownLatch ( 1 );
    Deferred < Boolean > deferred = scope.async ( signal -> release.await ( 5, TimeUnit.SECONDS ) );

    assertThatThrownBy ( () -> deferred.await ( Duration.ofMillis ( 20 ) ) )
      .isInstanceOf ( JobTimeoutException.class )
      .hasMessageContaining ( "did not finish within" );
    assertThat ( deferred.isDone () ).isFalse ();

    release.countDown ();
    assertThat ( deferred.await ( Duration.ofSeconds ( 2 ) ) ).isTrue ();
  }

  @Test
  @Timeout ( 5 )
  void shouldPostOutcomeToContextWhenAwaitingWithoutBlocking () {
    Deferred < Integer > deferred = scope.async ( signal -> 7 );
    List < Outcome < Integer > > outcomes = new ArrayList <> ();

    deferred.await ( main, outcome -> {
      outcomes.add ( outcome );
      main.stop ();
    } );
    main.run ();

    assertThat ( outcomes ).hasSize ( 1 );
    assertThat ( outcomes.get ( 0 ).value () ).isEqualTo ( 7 );
  }

  @Test
  @Timeout ( 5 )
  void shouldResumeOnCurrentContext () {
    Deferred < Integer > deferred = scope.async ( signal -> 9 );
    List < String > log = new ArrayList <> ();

    main.post ( () -> deferred.await ( outcome -> {
      log.add ( outcome.value () + " on " + Thread.currentThread ().getName () );
      main.stop ();
    } ) );
    main.run ();

    assertThat ( log ).containsExactly ( "9 on " + Thread.currentThread ().getName () );
  }

  @Test
  void shouldRequireContextForImplicitAwait () {
    Deferred < Integer > deferred = scope.async ( signal -> 1 );

    assertThatThrownBy ( () -> deferred.await ( outcome -> {
    } ) )
      .isInstanceOf ( IllegalStateException.class )
      .hasMessageContaining ( "is not running an execution context" );
  }
}
