package io.cronagent.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A named, independently schedulable unit as stored by the job store.
 * Immutable; every change produces a new instance.
 */
public record Job(
        // identity
        String id,
        String name,

        // scheduling
        boolean enabled,
        Schedule schedule,
        boolean deleteAfterRun,

        // payload
        JobPayload payload,

        // run state
        JobState state,
        Instant createdAt,
        Instant updatedAt
) {

    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        name = name == null ? "" : name;
    }

    public Instant nextRunAt() {
        return state.nextRunAt();
    }

    /**
     * True when the scheduler should keep an entry for this job in its dispatch queue.
     */
    public boolean isArmed() {
        return enabled && state.nextRunAt() != null;
    }

    /**
     * An enabled one-shot job whose instant has passed. Inert until edited.
     */
    public boolean isSpent() {
        return enabled && state.nextRunAt() == null && schedule.kind() == ScheduleKind.AT;
    }

    public Job withState(JobState newState, Instant now) {
        return new Job(id, name, enabled, schedule, deleteAfterRun, payload, newState, createdAt, touch(now));
    }

    public Job withEnabled(boolean newEnabled, Instant nextRun, Instant now) {
        return new Job(id, name, newEnabled, schedule, deleteAfterRun, payload,
                state.withNextRunAt(nextRun), createdAt, touch(now));
    }

    /**
     * The updatedAt to stamp on a mutation at {@code now}; never moves backwards, even if the clock does.
     */
    public Instant touch(Instant now) {
        return now.isAfter(updatedAt) ? now : updatedAt;
    }
}
