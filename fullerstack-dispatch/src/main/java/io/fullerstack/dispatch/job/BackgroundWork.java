package io.fullerstack.dispatch.job;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Body of a job: runs on a pool worker and may poll the cancellation signal.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface BackgroundWork < T > {

  /**
   * Executes the work.
   *
   * @param signal cancellation flag for cooperative checks
   * @return the result, possibly null
   * @throws Exception any failure; it becomes the job's error
   */
  T execute ( CancellationSignal signal ) throws Exception;

  /**
   * Adapts work that never checks for cancellation.
   *
   * @param callable the work
   * @param <T>      result type
   * @return work ignoring the signal
   */
  static < T > BackgroundWork < T > of ( Callable < T > callable ) {
    Objects.requireNonNull ( callable, "Callable cannot be null" );
    return signal -> callable.call ();
  }
}
