package io.fullerstack.dispatch.valve;

import io.fullerstack.dispatch.clock.ManualTicker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValveTest {

  private final ManualTicker ticker = new ManualTicker ();
  private final Valve        valve  = new Valve ( "test", ticker );

  @AfterEach
  void cleanup () {
    valve.close ();
  }

  private void drainDue () throws InterruptedException {
    Runnable task;
    while ( ( task = valve.next ( false ) ) != null ) {
      try {
        task.run ();
      } finally {
        valve.finished ();
      }
    }
  }

  @Test
  void shouldReleaseImmediateEntriesInPostingOrder () throws InterruptedException {
    List < String > log = new ArrayList <> ();
    valve.submit ( () -> log.add ( "a" ) );
    valve.submit ( () -> log.add ( "b" ) );
    valve.submit ( () -> log.add ( "c" ) );

    drainDue ();

    assertThat ( log ).containsExactly ( "a", "b", "c" );
  }

  @Test
  void shouldHoldDelayedEntriesUntilDue () throws InterruptedException {
    List < String > log = new ArrayList <> ();
    valve.schedule ( () -> log.add ( "late" ), Duration.ofSeconds ( 2 ) );
    valve.schedule ( () -> log.add ( "early" ), Duration.ofSeconds ( 1 ) );
    valve.submit ( () -> log.add ( "now" ) );

    drainDue ();
    assertThat ( log ).containsExactly ( "now" );
    assertThat ( valve.size () ).isEqualTo ( 2 );

    ticker.advance ( Duration.ofSeconds ( 1 ) );
    drainDue ();
    assertThat ( log ).containsExactly ( "now", "early" );

    ticker.advance ( Duration.ofSeconds ( 5 ) );
    drainDue ();
    assertThat ( log ).containsExactly ( "now", "early", "late" );
  }

  @Test
  void shouldKeepPostingOrderForEqualDueTimes () throws InterruptedException {
    List < Integer > log = new ArrayList <> ();
    for ( int i = 0; i < 5; i++ ) {
      int n = i;
      valve.schedule ( () -> log.add ( n ), Duration.ofMillis ( 100 ) );
    }
    ticker.advance ( Duration.ofMillis ( 100 ) );

    drainDue ();

    assertThat ( log ).containsExactly ( 0, 1, 2, 3, 4 );
  }

  @Test
  void shouldWithdrawCancelledEntry () throws InterruptedException {
    List < String > log = new ArrayList <> ();
    Posted posted = valve.schedule ( () -> log.add ( "withdrawn" ), Duration.ofMillis ( 10 ) );

    assertThat ( posted.isPending () ).isTrue ();
    assertThat ( posted.cancel () ).isTrue ();
    assertThat ( posted.cancel () ).isFalse ();

    ticker.advance ( Duration.ofMillis ( 10 ) );
    drainDue ();

    assertThat ( log ).isEmpty ();
    assertThat ( posted.isPending () ).isFalse ();
  }

  @Test
  void shouldNotCancelEntryAlreadyHandedOut () throws InterruptedException {
    Posted posted = valve.schedule ( () -> {
    }, Duration.ZERO );

    Runnable task = valve.next ( false );

    assertThat ( task ).isNotNull ();
    assertThat ( posted.cancel () ).isFalse ();
    valve.finished ();
  }

  @Test
  void shouldWakeParkedConsumerWhenManualTimeAdvances () throws Exception {
    List < String > log = new ArrayList <> ();
    valve.schedule ( () -> log.add ( "due" ), Duration.ofMinutes ( 1 ) );

    Thread consumer = new Thread ( () -> {
      try {
        Runnable task = valve.next ( true );
        task.run ();
        valve.finished ();
      } catch ( InterruptedException e ) {
        Thread.currentThread ().interrupt ();
      }
    } );
    consumer.start ();

    Thread.sleep ( 50 );
    assertThat ( log ).isEmpty ();

    ticker.advance ( Duration.ofMinutes ( 1 ) );
    consumer.join ( 2000 );

    assertThat ( consumer.isAlive () ).isFalse ();
    assertThat ( log ).containsExactly ( "due" );
  }

  @Test
  void shouldRefuseSubmissionsAfterClose () {
    valve.submit ( () -> {
    } );
    valve.submit ( () -> {
    } );

    assertThat ( valve.discard () ).isEqualTo ( 2 );
    assertThat ( valve.submit ( () -> {
    } ) ).isFalse ();
    assertThat ( valve.schedule ( () -> {
    }, Duration.ofSeconds ( 1 ) ).isPending () ).isFalse ();
    assertThat ( valve.isClosed () ).isTrue ();
  }

  @Test
  void shouldReturnNullFromParkedConsumerOnClose () throws Exception {
    Runnable[] taken = new Runnable[] { () -> {
    } };
    Thread consumer = new Thread ( () -> {
      try {
        taken[0] = valve.next ( true );
      } catch ( InterruptedException e ) {
        Thread.currentThread ().interrupt ();
      }
    } );
    consumer.start ();
    Thread.sleep ( 20 );

    valve.close ();
    consumer.join ( 2000 );

    assertThat ( consumer.isAlive () ).isFalse ();
    assertThat ( taken[0] ).isNull ();
  }

  @Test
  void shouldReportIdleOnlyWhenNothingDueOrExecuting () throws InterruptedException {
    assertThat ( valve.isIdle () ).isTrue ();

    valve.submit ( () -> {
    } );
    assertThat ( valve.isIdle () ).isFalse ();
    assertThat ( valve.awaitIdle ( Duration.ofMillis ( 20 ) ) ).isFalse ();

    Runnable task = valve.next ( false );
    assertThat ( valve.isIdle () ).isFalse ();
    task.run ();
    valve.finished ();

    assertThat ( valve.isIdle () ).isTrue ();
    assertThat ( valve.awaitIdle ( Duration.ofMillis ( 20 ) ) ).isTrue ();
  }

  @Test
  void shouldRejectNegativeDelay () {
    assertThatThrownBy ( () -> valve.schedule ( () -> {
    }, Duration.ofMillis ( -1 ) ) )
      .isInstanceOf ( IllegalArgumentException.class )
      .hasMessageContaining ( "negative" );
  }

  @Test
  void shouldRequireNonNullTask () {
    assertThatThrownBy ( () -> valve.submit ( null ) )
      .isInstanceOf ( NullPointerException.class )
      .hasMessageContaining ( "Task cannot be null" );
  }
}
