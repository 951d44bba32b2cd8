package io.deadlockssh.stats;

import io.deadlockssh.MutableClock;
import io.deadlockssh.ledger.OffenseLedger;
import io.deadlockssh.policy.DelayPolicy;
import io.deadlockssh.tarpit.TarpitStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;

class StatsReporterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final OffenseLedger ledger = new OffenseLedger(clock);
    private final TarpitStats stats = new TarpitStats(clock.instant());
    private StatsReporter reporter;

    @BeforeEach
    void setUp() {
        var policy = new DelayPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(5));
        reporter = new StatsReporter(ledger, stats, () -> 3, policy, 2, clock);

        record("10.0.0.1", 3);
        record("10.0.0.2", 1);
        record("10.0.0.3", 2);
        stats.connectionRejected();
        clock.advance(Duration.ofSeconds(90));
    }

    private void record(String address, int times) {
        for (int i = 0; i < times; i++) {
            ledger.record(address);
            stats.connectionAdmitted();
        }
    }

    @Test
    void report() {
        var report = reporter.report();

        assertEquals("2024-03-01T10:00:00Z", report.getStartTime());
        assertEquals(90, report.getUptimeSeconds());
        assertEquals(6, report.getTotalConnections());
        assertEquals(3, report.getActiveConnections());
        assertEquals(1, report.getRejectedConnections());
        assertEquals(3, report.getDistinctAddresses());
        assertEquals(List.of("10.0.0.1", "10.0.0.3", "10.0.0.2"), List.copyOf(report.getConnectionsPerIp().keySet()));
        assertEquals(2L, report.getConnectionsPerIp().get("10.0.0.3"));
    }

    @Test
    void topAddressesCarryTheirNextDelay() {
        var top = reporter.report().getTopAddresses();

        assertEquals(List.of("10.0.0.1", "10.0.0.3"), top.stream().map(AddressStat::getAddress).collect(toList()));
        assertEquals(5.0, top.get(0).getCurrentDelaySeconds());
        assertEquals(3.0, top.get(1).getCurrentDelaySeconds());
        assertEquals("2024-03-01T10:00:00Z", top.get(0).getFirstSeen());
    }

    @Test
    void reportingLeavesTheLedgerUntouched() {
        var before = ledger.snapshot();

        reporter.report();
        reporter.report();

        assertEquals(before, ledger.snapshot());
    }
}
