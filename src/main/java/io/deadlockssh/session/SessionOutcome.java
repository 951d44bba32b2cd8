package io.deadlockssh.session;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum SessionOutcome {
    /**
     * Banner delivered, then the peer closed or the tarpit wound the session down.
     */
    COMPLETED("completed"),
    /**
     * Peer went away before the banner was out, or the socket failed with an I/O error.
     */
    RESET("reset"),
    /**
     * Peer stayed silent for the idle period, or the listen ceiling was reached.
     */
    TIMEOUT("timeout"),
    ERROR("error"),
    /**
     * Closed at accept time: over capacity or the listener was draining.
     */
    REJECTED("rejected"),
    /**
     * Shutdown was observed when the pre-banner delay ended; closed without a banner.
     */
    DRAINED("drained"),
    /**
     * Still active at the end of the shutdown grace period.
     */
    FORCED("forced")
    ;

    @JsonValue
    private final String label;
}
