package io.fullerstack.dispatch.clock;

import java.time.Duration;

/**
 * Monotonic time source used for delayed posts and timeouts.
 * <p>
 * < p >Injected into {@link io.fullerstack.dispatch.valve.Valve} so tests can
 * drive delayed continuations deterministically with a {@link ManualTicker}
 * instead of sleeping.
 *
 * @see SystemTicker
 * @see ManualTicker
 */
@FunctionalInterface
public interface Ticker {

  /**
   * Current reading in nanoseconds. Only differences between readings are meaningful.
   *
   * @return monotonic nanosecond reading
   */
  long nanos ();

  /**
   * Reading that is {@code delay} after now, saturating on overflow.
   *
   * @param delay offset from now
   * @return the future reading
   */
  default long deadline ( Duration delay ) {
    long now = nanos ();
    long offset = delay.toNanos ();
    long deadline = now + offset;
    return ( offset > 0 && deadline < now ) ? Long.MAX_VALUE : deadline;
  }

  /**
   * @return the ticker backed by {@link System#nanoTime()}
   */
  static Ticker system () {
    return SystemTicker.INSTANCE;
  }
}
