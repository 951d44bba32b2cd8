package io.deadlockssh.session;

public enum SessionPhase {
    LIMBO,
    BANNER,
    LISTENING,
    CLOSED
}
