package io.deadlockssh.ledger;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.Objects.isNull;

/**
 * In-memory offense history keyed by source address. Lives as long as the process; nothing is persisted.
 * <p>
 * Increments are atomic per address. Writers share the read side of {@link #copyLock}, so unrelated
 * addresses never serialize on each other; {@link #snapshot()} takes the write side only while it copies,
 * which makes the copy a single point in time.
 */
@Slf4j
public class OffenseLedger {

    public static final Comparator<OffenseRecord> BY_COUNT_DESC = Comparator
            .comparingLong(OffenseRecord::getConnectionCount).reversed()
            .thenComparing(OffenseRecord::getAddress);

    private final ConcurrentMap<String, OffenseRecord> records = new ConcurrentHashMap<>();
    private final ReadWriteLock copyLock = new ReentrantReadWriteLock();
    private final Clock clock;

    public OffenseLedger() {
        this(Clock.systemUTC());
    }

    public OffenseLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Counts one more connection from {@code address}.
     *
     * @return the record after the increment, {@code connectionCount >= 1}
     */
    public OffenseRecord record(@NonNull String address) {
        var lock = copyLock.readLock();
        lock.lock();
        try {
            var now = clock.instant();
            return records.compute(address, (key, prev) -> isNull(prev) ? OffenseRecord.first(key, now) : prev.next(now));
        } finally {
            lock.unlock();
        }
    }

    public Optional<OffenseRecord> find(String address) {
        return Optional.ofNullable(records.get(address));
    }

    /**
     * @return every record, highest connection count first, ties by address
     */
    public List<OffenseRecord> snapshot() {
        List<OffenseRecord> copy;
        var lock = copyLock.writeLock();
        lock.lock();
        try {
            copy = new ArrayList<>(records.values());
        } finally {
            lock.unlock();
        }
        copy.sort(BY_COUNT_DESC);

        return copy;
    }

    public int size() {
        return records.size();
    }

    /**
     * Drops the addresses not seen for longer than {@code maxAge}. An address reconnecting while the sweep
     * runs keeps its record: removal only succeeds against the exact record that was judged stale.
     *
     * @return number of evicted addresses
     */
    public int evictIdle(@NonNull Duration maxAge) {
        var cutoff = clock.instant().minus(maxAge);
        var evicted = 0;
        for (OffenseRecord record : records.values()) {
            if (record.getLastSeen().isBefore(cutoff) && records.remove(record.getAddress(), record)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} ledger entries unseen since {}", evicted, cutoff);
        }

        return evicted;
    }
}
