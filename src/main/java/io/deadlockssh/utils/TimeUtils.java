package io.deadlockssh.utils;

import lombok.experimental.UtilityClass;

import java.time.Duration;

@UtilityClass
public class TimeUtils {

    /**
     * Converts fractional seconds from the configuration to a millisecond-precision duration.
     */
    public static Duration seconds(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    public static double toSeconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
