package io.fullerstack.dispatch.error;

/**
 * Raised when work cannot be accepted: the pool is shut down, its queue is at
 * capacity, or the owning scope has already been cancelled.
 * <p>
 * < p >Rejected work never runs.
 */
public class RejectedSubmissionException extends DispatchException {

  public RejectedSubmissionException ( String message ) {
    super ( message );
  }
}
