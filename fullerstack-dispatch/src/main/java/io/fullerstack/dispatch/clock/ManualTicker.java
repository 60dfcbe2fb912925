package io.fullerstack.dispatch.clock;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Ticker} that only moves when told to.
 * <p>
 * < p >Components that park until a deadline register an advance listener so
 * that {@link #advance(Duration)} wakes them; otherwise a parked loop would
 * never notice that manual time passed.
 * <p>
 * < p >< b >Usage:</b >
 * < pre >
 * ManualTicker ticker = new ManualTicker ();
 * LoopingContext main = LoopingContext.builder ( "main" ).ticker ( ticker ).build ();
 * main.postDelayed ( task, Duration.ofSeconds ( 5 ) );
 * ticker.advance ( Duration.ofSeconds ( 5 ) );
 * main.drain (); // task runs
 * </pre >
 */
public final class ManualTicker implements Ticker {

  private final AtomicLong       now       = new AtomicLong ();
  private final List < Runnable > listeners = new CopyOnWriteArrayList <> ();

  @Override
  public long nanos () {
    return now.get ();
  }

  /**
   * Moves time forward and notifies advance listeners.
   *
   * @param amount non-negative amount of time
   * @throws IllegalArgumentException if amount is negative
   */
  public void advance ( Duration amount ) {
    Objects.requireNonNull ( amount, "Amount cannot be null" );
    if ( amount.isNegative () ) {
      throw new IllegalArgumentException ( "Cannot move a ticker backwards: " + amount );
    }
    now.addAndGet ( amount.toNanos () );
    listeners.forEach ( Runnable::run );
  }

  /**
   * Registers a callback run after every {@link #advance(Duration)}.
   *
   * @param listener callback, must be fast and non-blocking
   */
  public void onAdvance ( Runnable listener ) {
    listeners.add ( Objects.requireNonNull ( listener, "Listener cannot be null" ) );
  }

  @Override
  public String toString () {
    return "ManualTicker[" + now.get () + "ns]";
  }
}
