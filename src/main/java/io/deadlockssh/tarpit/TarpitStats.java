package io.deadlockssh.tarpit;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide counters next to the ledger. Written by the listener, read by the stats presenter.
 */
public class TarpitStats {
    @Getter
    private final Instant startTime;
    private final LongAdder totalConnections = new LongAdder();
    private final LongAdder rejectedConnections = new LongAdder();

    public TarpitStats(Instant startTime) {
        this.startTime = startTime;
    }

    public void connectionAdmitted() {
        totalConnections.increment();
    }

    public void connectionRejected() {
        rejectedConnections.increment();
    }

    public long totalConnections() {
        return totalConnections.sum();
    }

    public long rejectedConnections() {
        return rejectedConnections.sum();
    }
}
