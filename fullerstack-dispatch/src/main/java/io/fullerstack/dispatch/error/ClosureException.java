package io.fullerstack.dispatch.error;

/**
 * Raised when background work threw. The original throwable is always the cause.
 */
public class ClosureException extends DispatchException {

  public ClosureException ( String message, Throwable cause ) {
    super ( message, cause );
  }
}
