package io.fullerstack.dispatch.error;

import java.time.Duration;

/**
 * Raised when a deadline fired before the job reached a terminal state.
 */
public class JobTimeoutException extends DispatchException {

  private final Duration timeout;

  public JobTimeoutException ( String message, Duration timeout ) {
    super ( message );
    this.timeout = timeout;
  }

  /**
   * @return the deadline that was exceeded
   */
  public Duration timeout () {
    return timeout;
  }
}
