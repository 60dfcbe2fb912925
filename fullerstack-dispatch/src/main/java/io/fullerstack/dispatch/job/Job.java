package io.fullerstack.dispatch.job;

import io.fullerstack.dispatch.scope.JobScope;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Handle to one scheduled unit of background work.
 *
 * @param <T> result type
 * @see JobState
 * @see DispatchJob
 */
public interface Job < T > {

  JobId id ();

  JobState state ();

  /**
   * Requests cancellation. A queued job is withdrawn and never runs; a running job
   * sees its {@link CancellationSignal} set and its eventual result is discarded.
   *
   * @return true if this call moved the job to CANCELLED
   */
  boolean cancel ();

  /**
   * @return the scope that owns this job, if any (back reference only)
   */
  Optional < JobScope > scope ();

  /**
   * @return the terminal outcome, empty while the job is not terminal
   */
  Optional < Outcome < T > > outcome ();

  /**
   * Registers a callback for the terminal outcome. Runs on the thread that ends the
   * job, or immediately on the caller if the job is already terminal.
   *
   * @param listener callback, must be fast and non-blocking
   */
  void whenTerminal ( Consumer < ? super Outcome < T > > listener );

  default boolean isDone () {
    return state ().isTerminal ();
  }

  default boolean isCancelled () {
    return state () == JobState.CANCELLED;
  }

  default Optional < T > result () {
    return outcome ().flatMap ( Outcome::result );
  }

  default Optional < Throwable > error () {
    return outcome ().map ( Outcome::error );
  }
}
