package io.fullerstack.dispatch.context;

import io.fullerstack.dispatch.valve.Posted;

import java.time.Duration;

/**
 * A single-threaded home whose posted continuations execute strictly in order.
 * <p>
 * < p >Continuations posted to one context run one at a time, in posting order, and
 * are never interrupted. A continuation posted from within another continuation on
 * the same context is appended behind everything already queued.
 *
 * @see LoopingContext
 */
public interface ExecutionContext {

  /**
   * @return the context label
   */
  String name ();

  /**
   * Enqueues a continuation and returns immediately.
   *
   * @param continuation zero-argument unit of work
   * @return true if accepted, false if the context was stopped
   */
  boolean post ( Runnable continuation );

  /**
   * Enqueues a continuation that becomes due after {@code delay}.
   *
   * @param continuation zero-argument unit of work
   * @param delay        non-negative delay
   * @return handle that can withdraw the continuation before it runs
   */
  Posted postDelayed ( Runnable continuation, Duration delay );

  /**
   * Runs the loop on the calling thread until {@link #stop()}.
   */
  void run ();

  /**
   * Ends the loop once the current continuation (if any) finishes. Nothing further is drained.
   */
  void stop ();

  /**
   * @return true if the calling thread is the one running this context
   */
  boolean isCurrent ();
}
