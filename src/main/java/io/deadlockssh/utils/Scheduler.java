package io.deadlockssh.utils;

import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.Executors.newSingleThreadScheduledExecutor;

@UtilityClass
@Slf4j
public class Scheduler {

    /**
     * Single daemon thread for periodic maintenance, so it never keeps the JVM alive.
     */
    public static ScheduledExecutorService newMaintenanceScheduler(String name) {
        return newSingleThreadScheduledExecutor(new DefaultThreadFactory(name, true));
    }

    /**
     * Like {@link ScheduledExecutorService#scheduleWithFixedDelay}, except that an exception thrown by
     * {@code command} is logged instead of silently cancelling every later run.
     */
    public static ScheduledFuture<?> scheduleWithFixedDelaySafe(
            ScheduledExecutorService executor,
            Runnable command,
            long delay,
            TimeUnit unit
    ) {
        return executor.scheduleWithFixedDelay(
                () -> {
                    try {
                        command.run();
                    } catch (Exception e) {
                        log.error("Error while execute task", e);
                    }
                }, delay, delay, unit);
    }
}
