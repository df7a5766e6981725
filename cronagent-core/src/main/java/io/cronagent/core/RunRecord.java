package io.cronagent.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Completed execution handed to the job store for write-back.
 *
 * @param status           ok or error
 * @param error            failure reason, ignored for ok
 * @param intendedFireTime the fire time the run was meant for; the next occurrence is computed
 *                         from it rather than from the wall clock, so run latency does not drift
 *                         the schedule
 */
public record RunRecord(RunStatus status, String error, Instant intendedFireTime) {

    public RunRecord {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(intendedFireTime, "intendedFireTime must not be null");
        if (status == RunStatus.NONE) {
            throw new IllegalArgumentException("a completed run must be ok or error");
        }
    }

    public static RunRecord ok(Instant intendedFireTime) {
        return new RunRecord(RunStatus.OK, null, intendedFireTime);
    }

    public static RunRecord error(String error, Instant intendedFireTime) {
        return new RunRecord(RunStatus.ERROR, error, intendedFireTime);
    }
}
