package io.cronagent.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime configuration for the scheduler loop and executor.
 *
 * @param workerThreads   size of the pool that runs due jobs; bounds fan-out when many jobs share a fire time
 * @param maxRunDuration  upper bound for one call into the action runtime; exceeding it records an error
 * @param resyncEvery     how often the loop rebuilds its queue from the store
 * @param maxErrorLength  recorded lastError is truncated to this many characters
 * @param shutdownTimeout how long stop() waits for in-flight runs
 */
public record SchedulerSettings(
        int workerThreads,
        Duration maxRunDuration,
        Duration resyncEvery,
        int maxErrorLength,
        Duration shutdownTimeout
) {

    public SchedulerSettings {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        requirePositive(maxRunDuration, "maxRunDuration");
        requirePositive(resyncEvery, "resyncEvery");
        requirePositive(shutdownTimeout, "shutdownTimeout");
        if (maxErrorLength < 16) {
            throw new IllegalArgumentException("maxErrorLength must be at least 16");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(8, Duration.ofMinutes(5), Duration.ofMinutes(1), 1024, Duration.ofSeconds(30));
    }

    public SchedulerSettings withWorkerThreads(int value) {
        return new SchedulerSettings(value, maxRunDuration, resyncEvery, maxErrorLength, shutdownTimeout);
    }

    public SchedulerSettings withMaxRunDuration(Duration value) {
        return new SchedulerSettings(workerThreads, value, resyncEvery, maxErrorLength, shutdownTimeout);
    }

    public SchedulerSettings withResyncEvery(Duration value) {
        return new SchedulerSettings(workerThreads, maxRunDuration, value, maxErrorLength, shutdownTimeout);
    }

    public SchedulerSettings withMaxErrorLength(int value) {
        return new SchedulerSettings(workerThreads, maxRunDuration, resyncEvery, value, shutdownTimeout);
    }

    public SchedulerSettings withShutdownTimeout(Duration value) {
        return new SchedulerSettings(workerThreads, maxRunDuration, resyncEvery, maxErrorLength, value);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
