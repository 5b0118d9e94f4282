package com.frameception.core.dispatch;

/**
 * Outcome of a user action handed to the {@link ActionDispatcher}.
 */
public enum DispatchResult {
    /** Preconditions not met; no backend call was made. */
    REFUSED,
    /** The backend accepted the mutation. */
    SUBMITTED,
    /** The backend call failed. */
    FAILED
}
