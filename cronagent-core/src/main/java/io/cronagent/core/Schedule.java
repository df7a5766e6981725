package io.cronagent.core;

import java.time.Duration;
import java.time.Instant;

/**
 * When a job fires. Exactly one variant exists per job:
 * <ul>
 *   <li>{@link AtSchedule}: once, at an absolute instant</li>
 *   <li>{@link EverySchedule}: repeatedly, at a fixed interval</li>
 *   <li>{@link CronSchedule}: at instants matching a 5-field cron expression in a timezone</li>
 * </ul>
 *
 * <p>Every variant validates itself on construction and throws {@link InvalidScheduleException},
 * so a schedule that exists is a schedule that can be evaluated.
 */
public interface Schedule {

    ScheduleKind kind();

    static Schedule at(Instant at) {
        return new AtSchedule(at);
    }

    static Schedule every(Duration interval) {
        return new EverySchedule(interval);
    }

    static Schedule everyMillis(long intervalMs) {
        return new EverySchedule(Duration.ofMillis(intervalMs));
    }

    static Schedule cron(String expression, String timezone) {
        return new CronSchedule(expression, timezone);
    }
}
