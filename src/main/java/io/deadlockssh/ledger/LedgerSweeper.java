package io.deadlockssh.ledger;

import io.deadlockssh.utils.Scheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

import static io.deadlockssh.utils.Scheduler.scheduleWithFixedDelaySafe;
import static java.util.Objects.nonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Periodically evicts ledger entries that have not been seen for {@code ledger_entry_ttl}. Only started when
 * that setting is positive; without it the ledger grows for the life of the process.
 */
@Slf4j
public class LedgerSweeper {
    private final OffenseLedger ledger;
    private final Duration entryTtl;
    private final Duration interval;

    private ScheduledExecutorService executor;

    public LedgerSweeper(OffenseLedger ledger, Duration entryTtl, Duration interval) {
        this.ledger = ledger;
        this.entryTtl = entryTtl;
        this.interval = interval;
    }

    public synchronized void start() {
        if (nonNull(executor)) {
            return;
        }
        executor = Scheduler.newMaintenanceScheduler("ledger-sweeper");
        scheduleWithFixedDelaySafe(executor, this::sweep, interval.toMillis(), MILLISECONDS);
        log.info("Ledger sweep every {} for entries unseen for {}", interval, entryTtl);
    }

    public int sweep() {
        var evicted = ledger.evictIdle(entryTtl);
        if (evicted > 0) {
            log.info("Ledger sweep evicted {} addresses, {} remain", evicted, ledger.size());
        }

        return evicted;
    }

    public synchronized void stop() {
        if (nonNull(executor)) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
