package io.deadlockssh.config;

import io.deadlockssh.TarpitException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.function.Consumer;

import static io.deadlockssh.TarpitExceptionType.CONFIG_INVALID;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TarpitConfTest {

    private static void assertInvalid(Consumer<TarpitConf> mutation) {
        var conf = new TarpitConf();
        mutation.accept(conf);

        var e = assertThrows(TarpitException.class, conf::validate);
        assertEquals(CONFIG_INVALID, e.getType());
    }

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(() -> new TarpitConf().validate());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertInvalid(conf -> conf.setPort(70000));
        assertInvalid(conf -> conf.setPort(-1));
        assertInvalid(conf -> conf.setHttpStatsPort(65536));
        assertInvalid(conf -> conf.setMaxConnections(0));
        assertInvalid(conf -> conf.setSshBanner(""));
        assertInvalid(conf -> conf.setBindAddress(" "));
        assertInvalid(conf -> conf.setBannerDelay(-0.1));
        assertInvalid(conf -> conf.setInitialDelay(-1));
        assertInvalid(conf -> conf.setDelayIncrement(-2));
        assertInvalid(conf -> conf.setMaxDelay(0.5));
        assertInvalid(conf -> conf.setConnectionTimeout(0));
        assertInvalid(conf -> conf.setMaxListenTime(0));
        assertInvalid(conf -> conf.setShutdownGrace(0));
        assertInvalid(conf -> conf.setMaxInputLength(0));
        assertInvalid(conf -> conf.setStatsTopN(0));
        assertInvalid(conf -> conf.setLogBackupCount(-1));
        assertInvalid(conf -> {
            conf.setLedgerEntryTtl(3600);
            conf.setLedgerSweepInterval(0);
        });
    }

    @Test
    void subMillisecondTimeoutsAreInvalid() {
        assertInvalid(conf -> conf.setConnectionTimeout(0.0004));
        assertInvalid(conf -> conf.setMaxListenTime(0.0004));
        assertInvalid(conf -> conf.setShutdownGrace(0.0004));
        assertInvalid(conf -> {
            conf.setLedgerEntryTtl(3600);
            conf.setLedgerSweepInterval(0.0001);
        });
    }

    @Test
    void smallestTimeoutIsOneMillisecond() {
        var conf = new TarpitConf();
        conf.setConnectionTimeout(0.001);

        assertDoesNotThrow(conf::validate);
        assertEquals(Duration.ofMillis(1), conf.getConnectionTimeoutDuration());
    }

    @Test
    void logLevelMustBeKnown() {
        assertInvalid(conf -> conf.setLogLevel("VERBOSE"));
        assertInvalid(conf -> conf.setLogLevel(""));
        assertInvalid(conf -> conf.setLogLevel(null));
    }

    @Test
    void logLevelIsCaseInsensitive() {
        var conf = new TarpitConf();
        conf.setLogLevel("debug");

        assertDoesNotThrow(conf::validate);
    }

    @Test
    void ephemeralPortIsAllowed() {
        var conf = new TarpitConf();
        conf.setPort(0);

        assertDoesNotThrow(conf::validate);
    }

    @Test
    void durationsAreMillisecondPrecise() {
        var conf = new TarpitConf();
        conf.setBannerDelay(0.1);
        conf.setShutdownGrace(2.5);

        assertEquals(Duration.ofMillis(100), conf.getBannerDelayDuration());
        assertEquals(Duration.ofMillis(2500), conf.getShutdownGraceDuration());
        assertEquals(Duration.ofMinutes(5), conf.getConnectionTimeoutDuration());
    }
}
