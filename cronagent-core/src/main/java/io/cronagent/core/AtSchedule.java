package io.cronagent.core;

import java.time.Instant;

public record AtSchedule(Instant at) implements Schedule {

    public AtSchedule {
        if (at == null) {
            throw new InvalidScheduleException("schedule.at is required for kind 'at'");
        }
    }

    @Override
    public ScheduleKind kind() {
        return ScheduleKind.AT;
    }
}
