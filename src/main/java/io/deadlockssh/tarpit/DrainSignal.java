package io.deadlockssh.tarpit;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token shared by the listener and every session it admits. Once triggered it stays triggered.
 */
public class DrainSignal {
    private final AtomicBoolean draining = new AtomicBoolean(false);

    /**
     * @return {@code true} for the call that actually flipped the signal
     */
    public boolean trigger() {
        return draining.compareAndSet(false, true);
    }

    public boolean isDraining() {
        return draining.get();
    }
}
