package io.fullerstack.dispatch.clock;

/**
 * {@link Ticker} backed by {@link System#nanoTime()}.
 */
public final class SystemTicker implements Ticker {

  static final SystemTicker INSTANCE = new SystemTicker ();

  private SystemTicker () {
  }

  @Override
  public long nanos () {
    return System.nanoTime ();
  }

  @Override
  public String toString () {
    return "SystemTicker";
  }
}
