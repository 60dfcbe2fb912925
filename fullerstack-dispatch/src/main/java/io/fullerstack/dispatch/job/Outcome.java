package io.fullerstack.dispatch.job;

import io.fullerstack.dispatch.error.ClosureException;
import io.fullerstack.dispatch.error.DispatchException;
import io.fullerstack.dispatch.error.JobCancelledException;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable terminal result of a job: a value, an error, or cancellation.
 *
 * @param state terminal state
 * @param value result when COMPLETED, otherwise null
 * @param error cause when FAILED, otherwise null
 * @param <T>   result type
 */
public record Outcome < T >( JobState state, T value, Throwable error ) {

  public Outcome {
    Objects.requireNonNull ( state, "State cannot be null" );
    if ( !state.isTerminal () ) {
      throw new IllegalArgumentException ( "Outcome requires a terminal state, got " + state );
    }
    if ( state == JobState.FAILED ) {
      Objects.requireNonNull ( error, "Failed outcome requires an error" );
    }
  }

  public static < T > Outcome < T > completed ( T value ) {
    return new Outcome <> ( JobState.COMPLETED, value, null );
  }

  public static < T > Outcome < T > failed ( Throwable error ) {
    return new Outcome <> ( JobState.FAILED, null, error );
  }

  public static < T > Outcome < T > cancelled () {
    return new Outcome <> ( JobState.CANCELLED, null, null );
  }

  public boolean isSuccess () {
    return state == JobState.COMPLETED;
  }

  public boolean isFailure () {
    return state == JobState.FAILED;
  }

  public boolean isCancelled () {
    return state == JobState.CANCELLED;
  }

  /**
   * @return the value if COMPLETED and non-null
   */
  public Optional < T > result () {
    return Optional.ofNullable ( value );
  }

  /**
   * Yields the value or raises what ended the job.
   * <p>
   * < p >Dispatch exceptions (such as a timeout) are rethrown as they are; any other
   * error is wrapped in a {@link ClosureException} whose cause is the original throwable.
   *
   * @return the value when COMPLETED
   * @throws ClosureException      if the work threw
   * @throws JobCancelledException if the job was cancelled
   */
  public T getOrThrow () {
    switch ( state ) {
      case COMPLETED:
        return value;
      case FAILED:
        if ( error instanceof DispatchException ) {
          throw (DispatchException) error;
        }
        throw new ClosureException ( "Background work failed: " + error, error );
      default:
        throw new JobCancelledException ( "Job was cancelled" );
    }
  }
}
