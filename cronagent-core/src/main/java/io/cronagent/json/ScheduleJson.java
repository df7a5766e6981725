package io.cronagent.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.cronagent.core.AtSchedule;
import io.cronagent.core.CronSchedule;
import io.cronagent.core.EverySchedule;
import io.cronagent.core.InvalidScheduleException;
import io.cronagent.core.Schedule;
import io.cronagent.core.ScheduleKind;

import java.time.Instant;

/**
 * Wire form of a schedule: {@code {kind, atMs?, everyMs?, expr?, tz?}}. Only the fields of the
 * declared kind are read; the others are ignored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleJson(
        String kind,
        Long atMs,
        Long everyMs,
        String expr,
        String tz
) {

    public static ScheduleJson from(Schedule schedule) {
        if (schedule instanceof AtSchedule at) {
            return new ScheduleJson(ScheduleKind.AT.wireName(), at.at().toEpochMilli(), null, null, null);
        }
        if (schedule instanceof EverySchedule every) {
            return new ScheduleJson(ScheduleKind.EVERY.wireName(), null, every.interval().toMillis(), null, null);
        }
        if (schedule instanceof CronSchedule cron) {
            return new ScheduleJson(ScheduleKind.CRON.wireName(), null, null, cron.expression(), cron.timezone());
        }
        throw new IllegalArgumentException("Unsupported schedule type: " + schedule.getClass().getName());
    }

    /**
     * @throws InvalidScheduleException when the kind is unknown or its fields are missing
     */
    public Schedule toSchedule() {
        ScheduleKind k = ScheduleKind.fromWireName(kind);
        return switch (k) {
            case AT -> {
                if (atMs == null) {
                    throw new InvalidScheduleException("schedule.atMs is required for kind 'at'");
                }
                yield Schedule.at(Instant.ofEpochMilli(atMs));
            }
            case EVERY -> {
                if (everyMs == null) {
                    throw new InvalidScheduleException("schedule.everyMs is required for kind 'every'");
                }
                yield Schedule.everyMillis(everyMs);
            }
            case CRON -> Schedule.cron(expr, tz);
        };
    }
}
