package io.cronagent.utils;

import io.cronagent.core.InvalidScheduleException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronPatternTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "0 0 0 * * *",
            "0 0 *",
            "0 0 L * *",
            "0 0 ? * *",
            "0 0 * * 8",
            "0 0 * * MON#2",
            "0 0 * L *",
            "0 0 * LW *",
            "0 0 * 13 *",
            "0 0 32 * *",
            "0 24 * * *",
            "*/0 * * * *",
            "0 */0 * * *",
            "0 0 */0 * *",
            "0 0 * */0 *",
            "0 0 * * */0",
            "0 0 1,,2 * *",
            "61 * * * *",
            "@reboot"
    })
    void shouldRejectMalformedExpressions(String spec) {
        assertThrows(InvalidScheduleException.class, () -> CronPattern.parse(spec));
    }

    @Test
    void shouldTranslateWeekdaysToQuartzNumbering() {
        CronPattern pattern = CronPattern.parse("0 9 * * 1-5");

        assertEquals(List.of("0 0 9 ? * 2,3,4,5,6"), pattern.quartzExpressions());
    }

    @Test
    void shouldWrapRangeEndingOnSunday() {
        CronPattern pattern = CronPattern.parse("0 0 * * FRI-0");

        assertEquals(List.of("0 0 0 ? * 1,6,7"), pattern.quartzExpressions());
    }

    @Test
    void shouldKeepTwoExpressionsWhenBothDayFieldsAreRestricted() {
        CronPattern pattern = CronPattern.parse("0 0 1 * 1");

        assertEquals(List.of("0 0 0 1 * ?", "0 0 0 ? * 2"), pattern.quartzExpressions());
    }

    @Test
    void steppedDayOfMonthWithWeekdayShouldRequireBoth() {
        CronPattern pattern = CronPattern.parse("0 0 */2 * 1");

        assertEquals(List.of("0 0 0 ? * 2"), pattern.quartzExpressions());
        // 2024-01-08 is a Monday on an even day; 2024-01-15 is the next odd-day Monday.
        assertEquals(Instant.parse("2024-01-15T00:00:00Z"),
                pattern.nextAfter(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void steppedWeekdayWithDayOfMonthShouldRequireBoth() {
        CronPattern pattern = CronPattern.parse("30 6 13 * */7");

        // Sundays only, on the 13th: 2024-10-13.
        assertEquals(Instant.parse("2024-10-13T06:30:00Z"),
                pattern.nextAfter(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void monthNamesShouldBeAccepted() {
        CronPattern pattern = CronPattern.parse("0 0 1 jan-mar *");

        assertEquals(Instant.parse("2025-01-01T00:00:00Z"),
                pattern.nextAfter(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void macroShouldBehaveLikeItsExpansion() {
        Instant after = Instant.parse("2024-03-10T15:30:00Z");

        assertEquals(
                CronPattern.parse("0 0 * * *").nextAfter(after, ZoneOffset.UTC),
                CronPattern.parse("@daily").nextAfter(after, ZoneOffset.UTC));
        assertEquals(Instant.parse("2024-03-10T16:00:00Z"),
                CronPattern.parse("@hourly").nextAfter(after, ZoneOffset.UTC));
    }
}
