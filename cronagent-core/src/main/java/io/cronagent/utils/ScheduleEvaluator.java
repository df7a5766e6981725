package io.cronagent.utils;

import io.cronagent.core.AtSchedule;
import io.cronagent.core.CronSchedule;
import io.cronagent.core.EverySchedule;
import io.cronagent.core.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Computes fire times from schedule definitions. Pure functions of their arguments.
 * <p>
 * Supported variants:
 * <ul>
 *   <li>{@link AtSchedule}: the instant itself while it is still ahead, then never again</li>
 *   <li>{@link EverySchedule}: {@code after + interval}, millisecond granularity</li>
 *   <li>{@link CronSchedule}: earliest cron match strictly after {@code after} in the job's timezone</li>
 * </ul>
 * <p>
 * Cron search is capped at {@link #CRON_SEARCH_HORIZON_YEARS} years; an expression with no match in
 * that window (e.g. "0 0 30 2 *") is treated as having no further occurrence.
 */
public final class ScheduleEvaluator {

    public static final int CRON_SEARCH_HORIZON_YEARS = 4;

    private ScheduleEvaluator() {
    }

    /**
     * Next fire time strictly after {@code after}.
     *
     * @param schedule job schedule
     * @param after    reference instant (usually now, or the previous intended fire time)
     * @return next fire time, or {@code null} when the schedule will not fire again
     */
    public static Instant nextOccurrence(Schedule schedule, Instant after) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(after, "after must not be null");

        if (schedule instanceof AtSchedule at) {
            return at.at().isAfter(after) ? at.at() : null;
        }

        if (schedule instanceof EverySchedule every) {
            return after.truncatedTo(ChronoUnit.MILLIS).plus(every.interval());
        }

        if (schedule instanceof CronSchedule cron) {
            Instant next = cron.pattern().nextAfter(after, cron.zone());
            if (next == null || next.isAfter(horizonEnd(after))) {
                return null;
            }
            return next;
        }

        throw new IllegalArgumentException("Unsupported schedule type: " + schedule.getClass().getName());
    }

    /**
     * Next fire time after a run that was meant for {@code intendedFireTime}.
     * <p>
     * The schedule advances from the intended fire time, not from when the run finished, so execution
     * latency does not drift it. If the process stalled long enough for that occurrence to already be in
     * the past, missed occurrences are skipped instead of replayed:
     * <ul>
     *   <li>every: keeps its phase, {@code intended + k * interval > now}</li>
     *   <li>cron: first match after {@code now}</li>
     *   <li>at: spent</li>
     * </ul>
     *
     * @return next fire time strictly after {@code now}, or {@code null}
     */
    public static Instant nextRunAfterFire(Schedule schedule, Instant intendedFireTime, Instant now) {
        Objects.requireNonNull(intendedFireTime, "intendedFireTime must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Instant next = nextOccurrence(schedule, intendedFireTime);
        if (next == null || next.isAfter(now)) {
            return next;
        }

        if (schedule instanceof EverySchedule every) {
            long intervalMs = every.interval().toMillis();
            long behindMs = Duration.between(next, now).toMillis();
            long missed = behindMs / intervalMs + 1;
            return next.plusMillis(missed * intervalMs);
        }

        return nextOccurrence(schedule, now);
    }

    private static Instant horizonEnd(Instant after) {
        return after.atZone(ZoneOffset.UTC).plusYears(CRON_SEARCH_HORIZON_YEARS).toInstant();
    }
}
