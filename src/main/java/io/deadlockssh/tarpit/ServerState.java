package io.deadlockssh.tarpit;

public enum ServerState {
    STARTING,
    RUNNING,
    DRAINING,
    STOPPED
}
