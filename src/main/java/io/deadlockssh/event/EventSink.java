package io.deadlockssh.event;

/**
 * Receives the terminal record of every session. Called from Netty event loop threads, so implementations
 * must be thread-safe and must not block on slow I/O for long.
 */
public interface EventSink {

    void emit(SessionEvent event);
}
