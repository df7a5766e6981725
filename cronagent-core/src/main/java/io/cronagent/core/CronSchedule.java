package io.cronagent.core;

import io.cronagent.utils.CronPattern;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Cron variant. The expression is parsed here so that a malformed pattern is rejected when the
 * job is created or edited, never when it is dispatched.
 *
 * @param expression 5-field cron expression or macro such as {@code @daily}
 * @param timezone   IANA zone id (e.g. "Asia/Taipei"); null means system default
 */
public record CronSchedule(String expression, String timezone) implements Schedule {

    public CronSchedule {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("schedule.expr is required for kind 'cron'");
        }
        expression = expression.trim();
        timezone = (timezone == null || timezone.isBlank()) ? null : timezone.trim();
        if (timezone != null) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                throw new InvalidScheduleException("Unknown timezone: " + timezone, e);
            }
        }
        CronPattern.parse(expression);
    }

    public ZoneId zone() {
        return timezone != null ? ZoneId.of(timezone) : ZoneId.systemDefault();
    }

    public CronPattern pattern() {
        return CronPattern.parse(expression);
    }

    @Override
    public ScheduleKind kind() {
        return ScheduleKind.CRON;
    }
}
