package io.deadlockssh.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Immutable offense state of one source address. A new instance replaces the previous one on every
 * recorded connection.
 */
@Value
public class OffenseRecord {
    String address;
    long connectionCount;
    Instant firstSeen;
    Instant lastSeen;

    static OffenseRecord first(String address, Instant now) {
        return new OffenseRecord(address, 1, now, now);
    }

    OffenseRecord next(Instant now) {
        var count = connectionCount == Long.MAX_VALUE ? connectionCount : connectionCount + 1;
        return new OffenseRecord(address, count, firstSeen, now);
    }
}
