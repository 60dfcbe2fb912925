package io.fullerstack.dispatch.current;

import io.fullerstack.dispatch.context.ExecutionContext;

import java.util.Optional;

/**
 * Thread-based binding of the {@link ExecutionContext} a thread is currently running.
 * <p>
 * A context binds itself for the duration of its loop (or a drain) and unbinds when
 * the loop returns. Worker threads are never bound, so {@link #get()} answers the
 * question "am I on a context, and which one".
 */
public final class CurrentContext {

  // Binding for the calling thread; absent on worker and foreign threads
  private static final ThreadLocal < ExecutionContext > BOUND = new ThreadLocal <> ();

  private CurrentContext () {
  }

  /**
   * Returns the context bound to the calling thread.
   *
   * @return the running context, or empty when called off any context
   */
  public static Optional < ExecutionContext > get () {
    return Optional.ofNullable ( BOUND.get () );
  }

  /**
   * Returns the context bound to the calling thread or fails.
   *
   * @return the running context
   * @throws IllegalStateException if the calling thread runs no context
   */
  public static ExecutionContext require () {
    ExecutionContext context = BOUND.get ();
    if ( context == null ) {
      throw new IllegalStateException (
        "Thread '" + Thread.currentThread ().getName () + "' is not running an execution context"
      );
    }
    return context;
  }

  /**
   * Binds a context to the calling thread.
   *
   * @param context the context about to run on this thread
   * @return the previous binding (restore it with {@link #restore(ExecutionContext)})
   */
  public static ExecutionContext bind ( ExecutionContext context ) {
    ExecutionContext previous = BOUND.get ();
    BOUND.set ( context );
    return previous;
  }

  /**
   * Restores a binding returned by {@link #bind(ExecutionContext)}.
   *
   * @param previous the earlier binding, possibly null
   */
  public static void restore ( ExecutionContext previous ) {
    if ( previous == null ) {
      BOUND.remove ();
    } else {
      BOUND.set ( previous );
    }
  }
}
