package io.deadlockssh.policy;

import io.deadlockssh.config.TarpitConf;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

import static io.deadlockssh.utils.TimeUtils.seconds;

/**
 * Maps an offense count to the pre-banner wait: {@code min(max, initial + increment * (count - 1))}.
 * Stateless; one instance is shared by all sessions.
 */
@Getter
@ToString
public class DelayPolicy {
    private final long initialMillis;
    private final long incrementMillis;
    private final long maxMillis;

    public DelayPolicy(Duration initial, Duration increment, Duration max) {
        if (initial.isNegative() || increment.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException(
                    "Delays must satisfy 0 <= initial <= max and increment >= 0, got " + initial + ", " + increment + ", " + max
            );
        }
        this.initialMillis = initial.toMillis();
        this.incrementMillis = increment.toMillis();
        this.maxMillis = max.toMillis();
    }

    public DelayPolicy(TarpitConf conf) {
        this(seconds(conf.getInitialDelay()), seconds(conf.getDelayIncrement()), seconds(conf.getMaxDelay()));
    }

    public static Duration compute(long connectionCount, TarpitConf conf) {
        return new DelayPolicy(conf).compute(connectionCount);
    }

    public Duration compute(long connectionCount) {
        if (connectionCount < 1) {
            throw new IllegalArgumentException("Connection count must be at least 1, got " + connectionCount);
        }
        var steps = connectionCount - 1;
        long delay;
        if (incrementMillis == 0) {
            delay = initialMillis;
        } else if (steps > (maxMillis - initialMillis) / incrementMillis) {
            // the product would pass the ceiling (or overflow)
            delay = maxMillis;
        } else {
            delay = initialMillis + incrementMillis * steps;
        }

        return Duration.ofMillis(Math.min(delay, maxMillis));
    }
}
