package io.deadlockssh.stats;

import io.deadlockssh.ledger.OffenseLedger;
import io.deadlockssh.ledger.OffenseRecord;
import io.deadlockssh.policy.DelayPolicy;
import io.deadlockssh.tarpit.TarpitStats;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.function.IntSupplier;

import static io.deadlockssh.utils.TimeUtils.toSeconds;
import static java.util.stream.Collectors.toList;

/**
 * Read-only view over the ledger and the engine counters. Never mutates either.
 */
@RequiredArgsConstructor
public class StatsReporter {
    private final OffenseLedger ledger;
    private final TarpitStats stats;
    private final IntSupplier activeSessions;
    private final DelayPolicy delayPolicy;
    private final int topN;
    private final Clock clock;

    public StatsReport report() {
        var snapshot = ledger.snapshot();
        var perIp = new LinkedHashMap<String, Long>();
        snapshot.forEach(record -> perIp.put(record.getAddress(), record.getConnectionCount()));

        return StatsReport.builder()
                .startTime(stats.getStartTime().toString())
                .uptimeSeconds(Duration.between(stats.getStartTime(), clock.instant()).toSeconds())
                .totalConnections(stats.totalConnections())
                .activeConnections(activeSessions.getAsInt())
                .rejectedConnections(stats.rejectedConnections())
                .distinctAddresses(snapshot.size())
                .topAddresses(snapshot.stream().limit(topN).map(this::toAddressStat).collect(toList()))
                .connectionsPerIp(perIp)
                .build();
    }

    private AddressStat toAddressStat(OffenseRecord record) {
        return AddressStat.builder()
                .address(record.getAddress())
                .connectionCount(record.getConnectionCount())
                .currentDelaySeconds(toSeconds(delayPolicy.compute(record.getConnectionCount())))
                .firstSeen(record.getFirstSeen().toString())
                .lastSeen(record.getLastSeen().toString())
                .build();
    }
}
