package io.cronagent.utils;

import io.cronagent.core.InvalidScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A parsed 5-field cron expression (minute, hour, day-of-month, month, day-of-week).
 *
 * <p>Matching is delegated to Quartz {@link CronExpression}. The standard expression is translated
 * into Quartz syntax:
 * <ul>
 *   <li>a seconds field "0" is prepended</li>
 *   <li>day-of-week 0-7 (0 and 7 = Sunday) becomes Quartz 1-7 (1 = Sunday)</li>
 *   <li>when both day-of-month and day-of-week are restricted, a day matches if either matches;
 *       Quartz cannot express that in one expression, so two are kept and the earlier fire wins</li>
 *   <li>when one day field is a step over {@code *} and the other is restricted, a day must match
 *       both; the day-of-week expression is evaluated and its fires are filtered by day-of-month</li>
 * </ul>
 * Every field accepts numbers, {@code *}, ranges, lists and positive steps only; months and days of
 * week also accept their three-letter names. Quartz-only syntax ({@code ? L W #}) is rejected.
 */
public final class CronPattern {

    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *"
    );

    private static final List<String> DAY_NAMES = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");
    private static final List<String> MONTH_NAMES = List.of(
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC");

    // Upper bound on candidate days inspected when day-of-month filters day-of-week fires.
    private static final int MAX_FILTERED_DAYS = 5000;

    private final String expression;
    private final List<String> quartzExpressions;
    private final Set<Integer> daysOfMonth;

    private CronPattern(String expression, List<String> quartzExpressions, Set<Integer> daysOfMonth) {
        this.expression = expression;
        this.quartzExpressions = List.copyOf(quartzExpressions);
        this.daysOfMonth = daysOfMonth == null ? null : Set.copyOf(daysOfMonth);
    }

    /**
     * Parses and validates a cron expression.
     *
     * @throws InvalidScheduleException when the expression is malformed
     */
    public static CronPattern parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidScheduleException("Cron expression must not be empty");
        }
        String s = spec.trim();
        String body = s;
        if (s.startsWith("@")) {
            body = MACROS.get(s.toLowerCase(Locale.ROOT));
            if (body == null) {
                throw new InvalidScheduleException("Unsupported cron macro: " + spec);
            }
        }

        String[] parts = body.split("\\s+");
        if (parts.length != 5) {
            throw new InvalidScheduleException(
                    "Cron expression must have 5 fields (minute hour day-of-month month day-of-week): " + spec);
        }

        String minute = parts[0];
        String hour = parts[1];
        String dayOfMonth = parts[2];
        String month = parts[3];
        String dayOfWeek = parts[4];
        expand(minute, "minute", 0, 59, List.of(), spec);
        expand(hour, "hour", 0, 23, List.of(), spec);
        Set<Integer> monthDays = expand(dayOfMonth, "day-of-month", 1, 31, List.of(), spec);
        expand(month, "month", 1, 12, MONTH_NAMES, spec);
        String quartzDays = quartzDaysOfWeek(dayOfWeek, spec);

        List<String> quartz = new ArrayList<>(2);
        Set<Integer> filter = null;
        if ("*".equals(dayOfWeek)) {
            quartz.add(toQuartz(minute, hour, dayOfMonth, month, "?"));
        } else if ("*".equals(dayOfMonth)) {
            quartz.add(toQuartz(minute, hour, "?", month, quartzDays));
        } else if (dayOfMonth.startsWith("*") || dayOfWeek.startsWith("*")) {
            quartz.add(toQuartz(minute, hour, "?", month, quartzDays));
            filter = monthDays;
        } else {
            quartz.add(toQuartz(minute, hour, dayOfMonth, month, "?"));
            quartz.add(toQuartz(minute, hour, "?", month, quartzDays));
        }

        for (String q : quartz) {
            smokeTest(compile(q, spec), spec);
        }
        return new CronPattern(s, quartz, filter);
    }

    public String expression() {
        return expression;
    }

    /**
     * Quartz expressions this pattern evaluates (one, or two for day-of-month OR day-of-week).
     */
    public List<String> quartzExpressions() {
        return quartzExpressions;
    }

    /**
     * Earliest matching instant strictly after {@code after}, evaluated in {@code zone}.
     *
     * @return the next fire time, or {@code null} when none is found
     */
    public Instant nextAfter(Instant after, ZoneId zone) {
        Objects.requireNonNull(after, "after must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        Instant best = null;
        for (String q : quartzExpressions) {
            CronExpression exp = compile(q, expression);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            Instant next = daysOfMonth == null ? next(exp, after) : nextOnMatchingDay(exp, after, zone);
            if (next != null && (best == null || next.isBefore(best))) {
                best = next;
            }
        }
        return best;
    }

    private static Instant next(CronExpression exp, Instant after) {
        Date next = exp.getNextValidTimeAfter(Date.from(after));
        return next == null ? null : next.toInstant();
    }

    private Instant nextOnMatchingDay(CronExpression exp, Instant after, ZoneId zone) {
        Instant cursor = after;
        for (int i = 0; i < MAX_FILTERED_DAYS; i++) {
            Instant next = next(exp, cursor);
            if (next == null) {
                return null;
            }
            ZonedDateTime at = next.atZone(zone);
            if (daysOfMonth.contains(at.getDayOfMonth())) {
                return next;
            }
            cursor = at.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant().minusSeconds(1);
        }
        return null;
    }

    private static String toQuartz(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {
        return String.join(" ", "0", minute, hour, dayOfMonth, month, dayOfWeek);
    }

    private static CronExpression compile(String quartz, String spec) {
        try {
            return new CronExpression(quartz);
        } catch (ParseException | RuntimeException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + spec + "': " + e.getMessage(), e);
        }
    }

    // Quartz accepts some expressions at parse time that it cannot evaluate.
    private static void smokeTest(CronExpression exp, String spec) {
        try {
            exp.getNextValidTimeAfter(new Date());
        } catch (RuntimeException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + spec + "': " + e, e);
        }
    }

    // Validates one numeric field and returns the values it matches.
    private static Set<Integer> expand(String field, String name, int min, int max, List<String> names, String spec) {
        TreeSet<Integer> values = new TreeSet<>();
        for (String item : field.split(",", -1)) {
            String range = item;
            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                range = item.substring(0, slash);
                step = parseStep(item.substring(slash + 1), name, field, spec);
            }

            int from;
            int to;
            if ("*".equals(range)) {
                from = min;
                to = max;
            } else if (range.indexOf('-') >= 0) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw invalidField(name, field, spec);
                }
                from = fieldValue(bounds[0], name, field, min, max, names, spec);
                to = fieldValue(bounds[1], name, field, min, max, names, spec);
                if (to < from) {
                    throw invalidField(name, field, spec);
                }
            } else {
                from = fieldValue(range, name, field, min, max, names, spec);
                to = slash >= 0 ? max : from;
            }

            for (int v = from; v <= to; v += step) {
                values.add(v);
            }
        }
        return values;
    }

    private static int fieldValue(String token, String name, String field, int min, int max, List<String> names,
                                  String spec) {
        if (token.matches("\\d{1,2}")) {
            int value = Integer.parseInt(token);
            if (value < min || value > max) {
                throw invalidField(name, field, spec);
            }
            return value;
        }
        int idx = names.indexOf(token.toUpperCase(Locale.ROOT));
        if (idx < 0) {
            throw invalidField(name, field, spec);
        }
        return min + idx;
    }

    // Expands a standard day-of-week field into an explicit Quartz list (1 = Sunday).
    private static String quartzDaysOfWeek(String field, String spec) {
        TreeSet<Integer> days = new TreeSet<>();
        for (String item : field.split(",", -1)) {
            String range = item;
            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                range = item.substring(0, slash);
                step = parseStep(item.substring(slash + 1), "day-of-week", field, spec);
            }

            int from;
            int to;
            if ("*".equals(range)) {
                from = 0;
                to = 6;
            } else if (range.indexOf('-') >= 0) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw invalidDayOfWeek(field, spec);
                }
                from = dayValue(bounds[0], field, spec);
                to = dayValue(bounds[1], field, spec);
                if (to == 0 && from > 0) {
                    to = 7;
                }
                if (to < from) {
                    throw invalidDayOfWeek(field, spec);
                }
            } else {
                from = dayValue(range, field, spec);
                to = slash >= 0 ? 6 : from;
            }

            for (int d = from; d <= to; d += step) {
                days.add(d % 7);
            }
        }
        if (days.isEmpty()) {
            throw invalidDayOfWeek(field, spec);
        }
        return days.stream()
                .map(d -> String.valueOf(d + 1))
                .collect(Collectors.joining(","));
    }

    private static int dayValue(String token, String field, String spec) {
        if (token.matches("\\d{1,2}")) {
            int value = Integer.parseInt(token);
            if (value > 7) {
                throw invalidDayOfWeek(field, spec);
            }
            return value;
        }
        int idx = DAY_NAMES.indexOf(token.toUpperCase(Locale.ROOT));
        if (idx < 0) {
            throw invalidDayOfWeek(field, spec);
        }
        return idx;
    }

    private static int parseStep(String token, String name, String field, String spec) {
        if (!token.matches("\\d{1,2}")) {
            throw invalidField(name, field, spec);
        }
        int step = Integer.parseInt(token);
        if (step <= 0) {
            throw new InvalidScheduleException("Step must be positive in " + name + " field '" + field
                    + "' of cron expression: " + spec);
        }
        return step;
    }

    private static InvalidScheduleException invalidDayOfWeek(String field, String spec) {
        return invalidField("day-of-week", field, spec);
    }

    private static InvalidScheduleException invalidField(String name, String field, String spec) {
        return new InvalidScheduleException("Invalid " + name + " field '" + field + "' in cron expression: " + spec);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronPattern other)) return false;
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
