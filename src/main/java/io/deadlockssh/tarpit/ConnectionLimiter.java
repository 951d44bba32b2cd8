package io.deadlockssh.tarpit;

import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Global cap on simultaneously active sessions, kept in a single atomic counter.
 */
public class ConnectionLimiter {
    @Getter
    private final int maxConnections;
    private final AtomicInteger active = new AtomicInteger(0);
    private final Object idleMonitor = new Object();

    public ConnectionLimiter(int maxConnections) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1, got " + maxConnections);
        }
        this.maxConnections = maxConnections;
    }

    /**
     * Takes a slot if one is free. Never admits more than {@code maxConnections}, even under racing accepts.
     */
    public boolean tryAcquire() {
        while (true) {
            var current = active.get();
            if (current >= maxConnections) {
                return false;
            }
            if (active.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release() {
        if (active.decrementAndGet() <= 0) {
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
    }

    public int active() {
        return active.get();
    }

    /**
     * Waits until no slot is taken.
     *
     * @return {@code false} if sessions were still active when {@code timeout} ran out
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        var deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (active.get() > 0) {
                var remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                idleMonitor.wait(Math.max(1, remaining / 1_000_000));
            }
        }

        return true;
    }
}
