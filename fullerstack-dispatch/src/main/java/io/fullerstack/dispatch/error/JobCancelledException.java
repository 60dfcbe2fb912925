package io.fullerstack.dispatch.error;

/**
 * Raised by a cooperative cancellation check inside running work, and by
 * {@code await()} on a job that ended cancelled.
 */
public class JobCancelledException extends DispatchException {

  public JobCancelledException ( String message ) {
    super ( message );
  }
}
