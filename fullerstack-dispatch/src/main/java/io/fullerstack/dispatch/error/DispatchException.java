package io.fullerstack.dispatch.error;

/**
 * Base type for every failure raised by the dispatch runtime.
 * <p>
 * < p >All dispatch exceptions are unchecked. Callers that want to treat the
 * runtime's failures uniformly catch this type; callers interested in one
 * failure kind catch the concrete subclass.
 *
 * @see ClosureException
 * @see JobCancelledException
 * @see RejectedSubmissionException
 * @see JobTimeoutException
 */
public class DispatchException extends RuntimeException {

  public DispatchException ( String message ) {
    super ( message );
  }

  public DispatchException ( String message, Throwable cause ) {
    super ( message, cause );
  }
}
