package io.cronagent.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Editable fields of a job before it is created. Use {@link #builder()}.
 */
public record JobDraft(
        String name,
        boolean enabled,
        Schedule schedule,
        JobPayload payload,
        boolean deleteAfterRun
) {

    public JobDraft {
        if (schedule == null) {
            throw new InvalidScheduleException("schedule is required");
        }
        if (payload == null) {
            throw new InvalidPayloadException("payload is required");
        }
        name = name == null ? "" : name;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; {@code enabled} defaults to true.
     */
    public static final class Builder {
        private String name;
        private boolean enabled = true;
        private Schedule schedule;
        private JobPayload payload;
        private boolean deleteAfterRun;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
            return this;
        }

        /**
         * Run once at the given instant.
         */
        public Builder at(Instant time) {
            return schedule(Schedule.at(time));
        }

        /**
         * Repeat at a fixed interval.
         */
        public Builder every(Duration interval) {
            return schedule(Schedule.every(interval));
        }

        /**
         * Repeat at instants matching a 5-field cron expression; null timezone means system default.
         */
        public Builder cron(String expression, String timezone) {
            return schedule(Schedule.cron(expression, timezone));
        }

        public Builder payload(JobPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder message(String message) {
            return payload(JobPayload.message(message));
        }

        public Builder deleteAfterRun(boolean deleteAfterRun) {
            this.deleteAfterRun = deleteAfterRun;
            return this;
        }

        public JobDraft build() {
            return new JobDraft(name, enabled, schedule, payload, deleteAfterRun);
        }
    }
}
