package io.deadlockssh.policy;

import io.deadlockssh.config.TarpitConf;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DelayPolicyTest {

    private static TarpitConf conf(double initial, double increment, double max) {
        var conf = new TarpitConf();
        conf.setInitialDelay(initial);
        conf.setDelayIncrement(increment);
        conf.setMaxDelay(max);
        return conf;
    }

    @ParameterizedTest
    @CsvSource({
            "1, 1000",
            "2, 3000",
            "3, 5000",
            "4, 5000",
            "100, 5000"
    })
    void escalatesAndSaturates(long attempt, long expectedMillis) {
        var policy = new DelayPolicy(conf(1, 2, 5));

        assertEquals(Duration.ofMillis(expectedMillis), policy.compute(attempt));
    }

    @Test
    void firstConnectionGetsInitialDelay() {
        assertEquals(Duration.ofMillis(1500), DelayPolicy.compute(1, conf(1.5, 2, 60)));
    }

    @Test
    void defaultsMatchBundledConfiguration() {
        var policy = new DelayPolicy(new TarpitConf());

        assertEquals(Duration.ofSeconds(1), policy.compute(1));
        assertEquals(Duration.ofSeconds(3), policy.compute(2));
        assertEquals(Duration.ofSeconds(59), policy.compute(30));
        assertEquals(Duration.ofSeconds(60), policy.compute(31));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 17, 1_000_000})
    void zeroIncrementIsFlat(long attempt) {
        var policy = new DelayPolicy(conf(2, 0, 60));

        assertEquals(Duration.ofSeconds(2), policy.compute(attempt));
    }

    @Test
    void hugeCountsSaturateInsteadOfOverflowing() {
        var policy = new DelayPolicy(conf(0, 3600, 7200));

        assertEquals(Duration.ofHours(2), policy.compute(Long.MAX_VALUE));
        assertEquals(Duration.ofHours(2), policy.compute(Long.MAX_VALUE / 2));
    }

    @Test
    void fractionalSeconds() {
        var policy = new DelayPolicy(conf(0.1, 0.2, 0.5));

        assertEquals(Duration.ofMillis(100), policy.compute(1));
        assertEquals(Duration.ofMillis(300), policy.compute(2));
        assertEquals(Duration.ofMillis(500), policy.compute(3));
        assertEquals(Duration.ofMillis(500), policy.compute(4));
    }

    @Test
    void nonDecreasing() {
        var policy = new DelayPolicy(conf(0.3, 0.7, 13));
        var previous = Duration.ZERO;
        for (long attempt = 1; attempt < 200; attempt++) {
            var delay = policy.compute(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "delay decreased at attempt " + attempt);
            previous = delay;
        }
    }

    @Test
    void rejectsCountBelowOne() {
        var policy = new DelayPolicy(conf(1, 2, 5));

        assertThrows(IllegalArgumentException.class, () -> policy.compute(0));
    }

    @Test
    void rejectsCeilingBelowInitialDelay() {
        assertThrows(IllegalArgumentException.class,
                () -> new DelayPolicy(Duration.ofSeconds(5), Duration.ZERO, Duration.ofSeconds(1)));
    }
}
