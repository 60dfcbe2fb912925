package io.fullerstack.dispatch.job;

import io.fullerstack.dispatch.error.JobCancelledException;

/**
 * Cooperative cancellation flag handed to running work.
 * <p>
 * < p >Workers are never interrupted. Long-running work polls this signal at its
 * natural checkpoints (between pages, between retries, before committing) and
 * stops early when it is set.
 */
public interface CancellationSignal {

  /**
   * @return true once cancellation was requested
   */
  boolean isCancelled ();

  /**
   * Stops the work by throwing if cancellation was requested.
   *
   * @throws JobCancelledException if cancelled
   */
  default void throwIfCancelled () {
    if ( isCancelled () ) {
      throw new JobCancelledException ( "Job was cancelled" );
    }
  }
}
