package io.fullerstack.dispatch.job;

/**
 * Lifecycle of a {@link Job}.
 * <p>
 * < p >Transitions are monotonic:
 * < pre >
 * CREATED ──▶ RUNNING ──▶ COMPLETED | FAILED | CANCELLED
 *    └──────────────────▶ CANCELLED
 * </pre >
 * Nothing leaves a terminal state.
 */
public enum JobState {

  CREATED,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  /**
   * @return true for COMPLETED, FAILED and CANCELLED
   */
  public boolean isTerminal () {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /**
   * @param next candidate state
   * @return true if moving from this state to {@code next} is allowed
   */
  public boolean canTransitionTo ( JobState next ) {
    switch ( this ) {
      case CREATED:
        return next == RUNNING || next == CANCELLED;
      case RUNNING:
        return next.isTerminal ();
      default:
        return false;
    }
  }
}
