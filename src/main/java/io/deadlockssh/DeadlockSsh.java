package io.deadlockssh;

import io.deadlockssh.config.TarpitConf;
import io.deadlockssh.event.EventSink;
import io.deadlockssh.ledger.LedgerSweeper;
import io.deadlockssh.ledger.OffenseLedger;
import io.deadlockssh.stats.StatsReporter;
import io.deadlockssh.stats.StatsServer;
import io.deadlockssh.tarpit.TarpitContext;
import io.deadlockssh.tarpit.TarpitServer;
import io.deadlockssh.tarpit.TarpitStats;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import sun.misc.Signal;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.nonNull;
import static java.util.stream.Collectors.joining;

/**
 * One running honeypot: the offense ledger, the tarpit listener and, when enabled, the stats endpoint and the
 * ledger sweeper. The ledger is created here and handed to the collaborators that need it.
 * <p>
 * Lifecycle: {@link #start()}, then {@link #shutdown()} from a signal, a shutdown hook or a test.
 * {@link #awaitTermination()} returns once the listener has stopped and the final statistics are logged.
 */
@Slf4j
public class DeadlockSsh {

    private static final int FINAL_REPORT_TOP_N = 5;

    @Getter
    private final TarpitConf conf;
    @Getter
    private final OffenseLedger ledger;
    @Getter
    private final TarpitStats stats;
    @Getter
    private final TarpitServer tarpitServer;
    @Getter
    private final StatsReporter statsReporter;

    private final Clock clock;
    private final StatsServer statsServer;
    private final LedgerSweeper ledgerSweeper;
    private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    public DeadlockSsh(TarpitConf conf, EventSink eventSink) {
        this(conf, eventSink, Clock.systemUTC());
    }

    public DeadlockSsh(TarpitConf conf, EventSink eventSink, Clock clock) {
        this.conf = conf;
        this.clock = clock;
        this.ledger = new OffenseLedger(clock);
        this.stats = new TarpitStats(clock.instant());

        var context = new TarpitContext(conf, ledger, eventSink, stats, clock);
        this.tarpitServer = new TarpitServer(context);
        this.statsReporter = new StatsReporter(
                ledger, stats, tarpitServer::activeSessions, context.getDelayPolicy(), conf.getStatsTopN(), clock
        );
        this.statsServer = conf.isEnableHttpStats()
                ? new StatsServer(conf.getBindAddress(), conf.getHttpStatsPort(), statsReporter)
                : null;
        this.ledgerSweeper = conf.getLedgerEntryTtl() > 0
                ? new LedgerSweeper(ledger, conf.getLedgerEntryTtlDuration(), conf.getLedgerSweepIntervalDuration())
                : null;

        log.info("DeadlockSSH initialized");
    }

    /**
     * Binds the tarpit. A bind failure is fatal and propagates; the stats endpoint failing to bind is only
     * logged, the trap keeps running without it.
     */
    public void start() throws TarpitException {
        tarpitServer.start();

        if (nonNull(statsServer)) {
            try {
                statsServer.start();
            } catch (TarpitException e) {
                log.error(e.getMessage(), e.getCause());
            }
        }
        if (nonNull(ledgerSweeper)) {
            ledgerSweeper.start();
        }
    }

    /**
     * Routes SIGINT and SIGTERM to {@link #shutdown()}, so that draining completes and the process exits with 0.
     */
    public void installSignalHandlers() {
        Signal.handle(new Signal("INT"), this::onSignal);
        Signal.handle(new Signal("TERM"), this::onSignal);
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "deadlockssh-shutdown-hook"));
    }

    private void onSignal(Signal signal) {
        log.info("Received signal {}, shutting down gracefully...", signal.getName());
        // signal dispatch thread must not block for the grace period
        new Thread(this::shutdown, "deadlockssh-shutdown").start();
    }

    /**
     * Drains the tarpit and stops the collaborators. Blocks until everything is stopped; later calls just
     * wait for the first one to finish.
     */
    public void shutdown() {
        if (!shutdownStarted.compareAndSet(false, true)) {
            try {
                terminated.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return;
        }
        log.info("Shutting down DeadlockSSH...");
        try {
            if (nonNull(ledgerSweeper)) {
                ledgerSweeper.stop();
            }
            if (nonNull(statsServer)) {
                statsServer.stop();
            }
            if (!tarpitServer.shutdown()) {
                log.warn("Some sessions had to be force-closed at the end of the grace period");
            }

            logFinalStatistics();
            log.info("DeadlockSSH shutdown complete");
        } finally {
            terminated.countDown();
        }
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public int getStatsPort() {
        return nonNull(statsServer) ? statsServer.getPort() : -1;
    }

    private void logFinalStatistics() {
        var report = statsReporter.report();
        log.info("Final statistics:");
        log.info("  Total connections: {}", report.getTotalConnections());
        log.info("  Rejected connections: {}", report.getRejectedConnections());
        log.info("  Distinct addresses: {}", report.getDistinctAddresses());
        log.info("  Uptime: {}", Duration.between(stats.getStartTime(), clock.instant()));
        log.info("  Top attacking IPs: {}", report.getTopAddresses().stream()
                .limit(FINAL_REPORT_TOP_N)
                .map(stat -> stat.getAddress() + "=" + stat.getConnectionCount())
                .collect(joining(", ", "{", "}")));
    }
}
