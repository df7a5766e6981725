package io.cronagent.core;

import java.time.Duration;

public record EverySchedule(Duration interval) implements Schedule {

    public EverySchedule {
        if (interval == null) {
            throw new InvalidScheduleException("schedule.every is required for kind 'every'");
        }
        if (interval.toMillis() <= 0) {
            throw new InvalidScheduleException("schedule.every must be a positive number of milliseconds: " + interval.toMillis());
        }
    }

    @Override
    public ScheduleKind kind() {
        return ScheduleKind.EVERY;
    }
}
