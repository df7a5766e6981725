package io.cronagent.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Mutable run state of a job, replaced as a whole on each change.
 *
 * @param nextRunAt  next intended fire time; null when disabled, spent or exhausted
 * @param lastRunAt  when the last completed run was recorded
 * @param lastStatus status of the last completed run
 * @param lastError  error of the last run when it failed
 */
public record JobState(
        Instant nextRunAt,
        Instant lastRunAt,
        RunStatus lastStatus,
        String lastError
) {

    public JobState {
        Objects.requireNonNull(lastStatus, "lastStatus must not be null");
    }

    public static JobState initial(Instant nextRunAt) {
        return new JobState(nextRunAt, null, RunStatus.NONE, null);
    }

    public JobState withNextRunAt(Instant next) {
        return new JobState(next, lastRunAt, lastStatus, lastError);
    }

    public JobState afterRun(Instant ranAt, RunStatus status, String error, Instant next) {
        return new JobState(next, ranAt, status, status == RunStatus.ERROR ? error : null);
    }
}
