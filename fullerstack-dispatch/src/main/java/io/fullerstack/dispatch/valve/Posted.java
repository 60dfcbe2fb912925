package io.fullerstack.dispatch.valve;

/**
 * Handle to a task sitting in a {@link Valve}.
 */
public interface Posted {

  /**
   * Removes the task if it has not been handed out yet.
   *
   * @return true if this call removed it
   */
  boolean cancel ();

  /**
   * @return true while the task is queued and not yet handed out or removed
   */
  boolean isPending ();
}
