package io.deadlockssh.tarpit;

/**
 * User events the server fires into session pipelines during shutdown.
 */
public enum SessionControlEvent {
    /**
     * Listener is draining; wind the session down at the next suspension point.
     */
    DRAIN,
    /**
     * Grace period is over; close now.
     */
    FORCE_CLOSE
}
