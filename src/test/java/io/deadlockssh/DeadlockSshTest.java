package io.deadlockssh;

import io.deadlockssh.config.TarpitConf;
import io.deadlockssh.tarpit.ServerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.deadlockssh.session.SessionOutcome.DRAINED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(30)
class DeadlockSshTest {

    private static TarpitConf conf() {
        var conf = new TarpitConf();
        conf.setBindAddress("127.0.0.1");
        conf.setPort(0);
        conf.setInitialDelay(0.5);
        conf.setBannerDelay(0);
        conf.setShutdownGrace(2);
        return conf;
    }

    @Test
    void shutdownDrainsAndReleasesWaiters() throws Exception {
        var sink = new RecordingEventSink();
        var honeypot = new DeadlockSsh(conf().validate(), sink);
        honeypot.start();

        try (var client = new Socket("127.0.0.1", honeypot.getTarpitServer().getPort())) {
            var deadline = System.currentTimeMillis() + 5_000;
            while (honeypot.getTarpitServer().activeSessions() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            var terminated = new CountDownLatch(1);
            var waiter = new Thread(() -> {
                try {
                    honeypot.awaitTermination();
                    terminated.countDown();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            waiter.start();

            honeypot.shutdown();

            assertTrue(terminated.await(5, TimeUnit.SECONDS));
            assertEquals(ServerState.STOPPED, honeypot.getTarpitServer().getState());
            assertEquals(DRAINED, sink.next().getOutcome());
            client.setSoTimeout(5_000);
            assertEquals(-1, client.getInputStream().read());
        }
    }

    @Test
    void repeatedShutdownIsHarmless() throws Exception {
        var honeypot = new DeadlockSsh(conf().validate(), new RecordingEventSink());
        honeypot.start();

        honeypot.shutdown();
        honeypot.shutdown();

        assertEquals(ServerState.STOPPED, honeypot.getTarpitServer().getState());
    }

    @Test
    void statsPortConflictDoesNotStopTheTarpit() throws Exception {
        try (var occupied = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
            var conf = conf();
            conf.setEnableHttpStats(true);
            conf.setHttpStatsPort(occupied.getLocalPort());
            var honeypot = new DeadlockSsh(conf.validate(), new RecordingEventSink());
            try {
                honeypot.start();

                assertEquals(ServerState.RUNNING, honeypot.getTarpitServer().getState());
            } finally {
                honeypot.shutdown();
            }
        }
    }

    @Test
    void sweeperIsOnlyStartedWithTtl() throws Exception {
        var clock = new MutableClock(Instant.now());
        var conf = conf();
        conf.setLedgerEntryTtl(60);
        conf.setLedgerSweepInterval(0.05);
        var honeypot = new DeadlockSsh(conf.validate(), new RecordingEventSink(), clock);
        honeypot.getLedger().record("192.0.2.1");
        honeypot.start();
        try {
            clock.advance(Duration.ofMinutes(2));
            var deadline = System.currentTimeMillis() + 5_000;
            while (honeypot.getLedger().size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertFalse(honeypot.getLedger().find("192.0.2.1").isPresent());
        } finally {
            honeypot.shutdown();
        }
    }
}
