package io.fullerstack.dispatch.context;

import io.fullerstack.dispatch.clock.ManualTicker;
import io.fullerstack.dispatch.current.CurrentContext;
import io.fullerstack.dispatch.valve.Posted;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class LoopingContextTest {

  private LoopingContext context;

  @AfterEach
  void cleanup () {
    if ( context != null ) {
      context.close ();
    }
  }

  @Test
  @DisplayName ( "Continuations run in the exact order they were posted" )
  @Timeout ( 5 )
  void shouldRunContinuationsInPostingOrder () {
    context = LoopingContext.create ( "main" );
    List < Integer > log = new ArrayList <> ();

    for ( int i = 0; i < 1000; i++ ) {
      int n = i;
      context.post ( () -> log.add ( n ) );
    }
    context.post ( context::stop );
    context.run ();

    assertThat ( log ).hasSize ( 1000 );
    for ( int i = 0; i < 1000; i++ ) {
      assertThat ( log.get ( i ) ).isEqualTo ( i );
    }
  }

  @Test
  @DisplayName ( "Producers on many threads interleave only at item granularity" )
  @Timeout ( 10 )
  void shouldPreservePerProducerOrderAcrossThreads () throws Exception {
    context = LoopingContext.create ( "main" ).start ();
    List < String > log = Collections.synchronizedList ( new ArrayList <> () );
    int producers = 4;
    int perProducer = 250;
    CountDownLatch ready = new CountDownLatch ( producers );

    List < Thread > threads = new ArrayList <> ();
    for ( int p = 0; p < producers; p++ ) {
      int producer = p;
      Thread thread = new Thread ( () -> {
        ready.countDown ();
        for ( int i = 0; i < perProducer; i++ ) {
          int n = i;
          context.post ( () -> {
            log.add ( producer + ":" + n + ":begin" );
            log.add ( producer + ":" + n + ":end" );
          } );
        }
      } );
      threads.add ( thread );
      thread.start ();
    }
    for ( Thread thread : threads ) {
      thread.join ();
    }
    assertThat ( context.awaitIdle ( Duration.ofSeconds ( 5 ) ) ).isTrue ();

    assertThat ( log ).hasSize ( producers * perProducer * 2 );
    int[] next = new int[producers];
    for ( int i = 0; i < log.size (); i += 2 ) {
      String[] begin = log.get ( i ).split ( ":" );
      String[] end = log.get ( i + 1 ).split ( ":" );
      assertThat ( begin[2] ).isEqualTo ( "begin" );
      assertThat ( end[0] + end[1] ).isEqualTo ( begin[0] + begin[1] );
      int producer = Integer.parseInt ( begin[0] );
      assertThat ( Integer.parseInt ( begin[1] ) ).isEqualTo ( next[producer]++ );
    }
  }

  @Test
  @DisplayName ( "A re-entrant post goes behind everything already queued" )
  @Timeout ( 5 )
  void shouldAppendReentrantPostsAfterQueuedItems () {
    context = LoopingContext.create ( "main" );
    List < String > log = new ArrayList <> ();

    context.post ( () -> {
      log.add ( "A" );
      context.post ( () -> log.add ( "A1" ) );
      context.post ( () -> log.add ( "A2" ) );
      log.add ( "A-end" );
    } );
    context.post ( () -> log.add ( "B" ) );
    context.post ( () -> log.add ( "C" ) );
    context.post ( () -> context.post ( context::stop ) );

    context.run ();

    assertThat ( log ).containsExactly ( "A", "A-end", "B", "C", "A1", "A2" );
  }

  @Test
  @DisplayName ( "A failing continuation is reported and the loop keeps going" )
  @Timeout ( 5 )
  void shouldReportFailuresAndKeepRunning () {
    ErrorSink errorSink = mock ( ErrorSink.class );
    context = LoopingContext.builder ( "main" ).errorSink ( errorSink ).build ();
    IllegalStateException boom = new IllegalStateException ( "boom" );
    List < String > log = new ArrayList <> ();

    context.post ( () -> log.add ( "before" ) );
    context.post ( () -> {
      throw boom;
    } );
    context.post ( () -> log.add ( "after" ) );
    context.post ( context::stop );
    context.run ();

    assertThat ( log ).containsExactly ( "before", "after" );
    verify ( errorSink ).report ( same ( context ), same ( boom ) );
    verifyNoMoreInteractions ( errorSink );
  }

  @Test
  @Timeout ( 5 )
  void shouldReportStackOverflowAndKeepRunning () {
    ErrorSink errorSink = mock ( ErrorSink.class );
    context = LoopingContext.builder ( "main" ).errorSink ( errorSink ).build ();
    List < String > log = new ArrayList <> ();

    context.post ( () -> recurse ( 0 ) );
    context.post ( () -> log.add ( "after" ) );
    context.post ( context::stop );
    context.run ();

    assertThat ( log ).containsExactly ( "after" );
    verify ( errorSink ).report ( same ( context ), isA ( StackOverflowError.class ) );
  }

  @Test
  @Timeout ( 5 )
  void shouldSurviveFailingErrorSink () {
    context = LoopingContext.builder ( "main" )
      .errorSink ( ( ctx, error ) -> {
        throw new IllegalArgumentException ( "sink broke" );
      } )
      .build ();
    List < String > log = new ArrayList <> ();

    context.post ( () -> {
      throw new IllegalStateException ( "boom" );
    } );
    context.post ( () -> log.add ( "still running" ) );
    context.post ( context::stop );
    context.run ();

    assertThat ( log ).containsExactly ( "still running" );
  }

  @Test
  @DisplayName ( "stop() lets the current continuation finish and drains nothing further" )
  @Timeout ( 5 )
  void shouldStopAfterCurrentContinuation () {
    context = LoopingContext.create ( "main" );
    List < String > log = new ArrayList <> ();

    context.post ( () -> {
      context.stop ();
      log.add ( "current finishes" );
    } );
    context.post ( () -> log.add ( "never" ) );
    context.run ();

    assertThat ( log ).containsExactly ( "current finishes" );
    assertThat ( context.isStopped () ).isTrue ();
    assertThat ( context.post ( () -> log.add ( "refused" ) ) ).isFalse ();
  }

  @Test
  @Timeout ( 5 )
  void shouldReturnImmediatelyWhenRunAfterStop () {
    context = LoopingContext.create ( "main" );
    context.stop ();

    context.run ();

    assertThat ( context.isStopped () ).isTrue ();
  }

  @Test
  void shouldBindCurrentContextWhileRunning () {
    context = LoopingContext.create ( "main" );
    AtomicReference < ExecutionContext > seen = new AtomicReference <> ();
    AtomicReference < Boolean > current = new AtomicReference <> ();

    context.post ( () -> {
      seen.set ( CurrentContext.require () );
      current.set ( context.isCurrent () );
    } );
    context.drain ();

    assertThat ( seen.get () ).isSameAs ( context );
    assertThat ( current.get () ).isTrue ();
    assertThat ( context.isCurrent () ).isFalse ();
    assertThat ( CurrentContext.get () ).isEmpty ();
  }

  @Test
  void shouldDrainOnlyWhatWasDueWhenDrainStarted () {
    context = LoopingContext.create ( "main" );
    List < String > log = new ArrayList <> ();

    context.post ( () -> {
      log.add ( "first" );
      context.post ( () -> log.add ( "posted during drain" ) );
    } );
    context.post ( () -> log.add ( "second" ) );

    assertThat ( context.drain () ).isEqualTo ( 2 );
    assertThat ( log ).containsExactly ( "first", "second" );

    assertThat ( context.drain () ).isEqualTo ( 1 );
    assertThat ( log ).containsExactly ( "first", "second", "posted during drain" );
  }

  @Test
  void shouldRunDelayedContinuationsWhenManualTimeAdvances () {
    ManualTicker ticker = new ManualTicker ();
    context = LoopingContext.builder ( "main" ).ticker ( ticker ).build ();
    List < String > log = new ArrayList <> ();

    context.postDelayed ( () -> log.add ( "5s" ), Duration.ofSeconds ( 5 ) );
    Posted withdrawn = context.postDelayed ( () -> log.add ( "withdrawn" ), Duration.ofSeconds ( 1 ) );
    context.post ( () -> log.add ( "now" ) );

    assertThat ( withdrawn.cancel () ).isTrue ();
    context.drain ();
    assertThat ( log ).containsExactly ( "now" );

    ticker.advance ( Duration.ofSeconds ( 5 ) );
    context.drain ();
    assertThat ( log ).containsExactly ( "now", "5s" );
  }

  @Test
  @Timeout ( 5 )
  void shouldRunDelayedContinuationOnStartedContext () throws InterruptedException {
    context = LoopingContext.create ( "main" ).start ();
    CountDownLatch fired = new CountDownLatch ( 1 );
    long start = System.nanoTime ();

    context.postDelayed ( fired::countDown, Duration.ofMillis ( 30 ) );

    assertThat ( fired.await ( 2, TimeUnit.SECONDS ) ).isTrue ();
    assertThat ( System.nanoTime () - start ).isGreaterThanOrEqualTo ( TimeUnit.MILLISECONDS.toNanos ( 30 ) );
  }

  @Test
  @Timeout ( 5 )
  void shouldRunOnDedicatedThreadNamedAfterContext () throws InterruptedException {
    context = LoopingContext.create ( "ui" ).start ();
    AtomicReference < String > threadName = new AtomicReference <> ();
    CountDownLatch ran = new CountDownLatch ( 1 );

    context.post ( () -> {
      threadName.set ( Thread.currentThread ().getName () );
      ran.countDown ();
    } );

    assertThat ( ran.await ( 2, TimeUnit.SECONDS ) ).isTrue ();
    assertThat ( threadName.get () ).isEqualTo ( "ui" );
  }

  @Test
  @Timeout ( 5 )
  void shouldRefuseSecondRunner () throws InterruptedException {
    context = LoopingContext.create ( "main" ).start ();
    CountDownLatch running = new CountDownLatch ( 1 );
    context.post ( running::countDown );
    assertThat ( running.await ( 2, TimeUnit.SECONDS ) ).isTrue ();

    assertThatThrownBy ( () -> context.run () )
      .isInstanceOf ( IllegalStateException.class )
      .hasMessageContaining ( "already running" );
    assertThatThrownBy ( () -> context.drain () )
      .isInstanceOf ( IllegalStateException.class )
      .hasMessageContaining ( "another thread" );
    assertThatThrownBy ( () -> context.start () )
      .isInstanceOf ( IllegalStateException.class )
      .hasMessageContaining ( "already started" );
  }

  @Test
  @Timeout ( 5 )
  void shouldRefuseAwaitIdleFromOwnThread () throws InterruptedException {
    context = LoopingContext.create ( "main" ).start ();
    AtomicReference < Throwable > failure = new AtomicReference <> ();
    CountDownLatch done = new CountDownLatch ( 1 );

    context.post ( () -> {
      try {
        context.awaitIdle ( Duration.ofMillis ( 10 ) );
      } catch ( IllegalStateException e ) {
        failure.set ( e );
      }
      done.countDown ();
    } );

    assertThat ( done.await ( 2, TimeUnit.SECONDS ) ).isTrue ();
    assertThat ( failure.get () )
      .isInstanceOf ( IllegalStateException.class )
      .hasMessageContaining ( "Cannot call Context::awaitIdle" );
  }

  @Test
  void shouldRejectBlankName () {
    assertThatThrownBy ( () -> LoopingContext.create ( " " ) )
      .isInstanceOf ( IllegalArgumentException.class );
    assertThatThrownBy ( () -> LoopingContext.create ( null ) )
      .isInstanceOf ( NullPointerException.class )
      .hasMessageContaining ( "Context name cannot be null" );
  }

  @Test
  void shouldRejectNullContinuation () {
    context = LoopingContext.create ( "main" );

    assertThatThrownBy ( () -> context.post ( null ) )
      .isInstanceOf ( NullPointerException.class )
      .hasMessageContaining ( "Continuation cannot be null" );
    assertThat ( context.pendingCount () ).isZero ();
  }

  private static int recurse ( int depth ) {
    return recurse ( depth + 1 ) + 1;
  }
}
