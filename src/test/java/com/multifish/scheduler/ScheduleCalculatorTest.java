package com.multifish.scheduler;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-02-10T10:00:00Z");

    private final ScheduleCalculator calculator = new ScheduleCalculator(ZoneOffset.UTC);

    @Test
    void continuousDailyRunsNextMorningWhenTodaysSlotPassed() {
        Schedule schedule = Schedule.continuous("02:00:00", Period.everyDay("2026-02-10", "2026-12-31"));

        ScheduleCalculator.NextRun next = calculator.nextRun(schedule, NOW);

        assertFalse(next.fallback());
        assertEquals(Instant.parse("2026-02-11T02:00:00Z"), next.time());
    }

    @Test
    void onceLaterTodayRunsToday() {
        assertEquals(Instant.parse("2026-02-10T11:30:00Z"),
                calculator.nextRunTime(Schedule.once("11:30:00"), NOW));
    }

    @Test
    void onceEarlierTodayRollsToTomorrow() {
        assertEquals(Instant.parse("2026-02-11T09:00:00Z"),
                calculator.nextRunTime(Schedule.once("09:00:00"), NOW));
    }

    @Test
    void onceAtExactlyNowIsStrictlyInTheFuture() {
        Instant next = calculator.nextRunTime(Schedule.once("10:00:00"), NOW);

        assertTrue(next.isAfter(NOW));
        assertEquals(Instant.parse("2026-02-11T10:00:00Z"), next);
    }

    @Test
    void weekdayFilterLandsOnMonday() {
        Period mondays = new Period("2026-02-01", "2026-12-31", List.of("Monday"), null);

        Instant next = calculator.nextRunTime(Schedule.continuous("02:00:00", mondays), NOW);

        assertEquals(Instant.parse("2026-02-16T02:00:00Z"), next);
        assertEquals(DayOfWeek.MONDAY, next.atZone(ZoneOffset.UTC).getDayOfWeek());
    }

    @Test
    void singleDayOfMonthMatches() {
        Period fifteenth = new Period("2026-02-01", "2026-12-31", List.of(), "15");

        assertEquals(Instant.parse("2026-02-15T02:00:00Z"),
                calculator.nextRunTime(Schedule.continuous("02:00:00", fifteenth), NOW));
    }

    @Test
    void dayOfMonthListIsComparedAsOneStringAndNeverMatches() {
        Period list = new Period("2026-02-01", "2026-12-31", List.of(), "1,15");

        ScheduleCalculator.NextRun next = calculator.nextRun(Schedule.continuous("02:00:00", list), NOW);

        assertTrue(next.fallback());
        assertEquals(NOW.plus(ScheduleCalculator.FALLBACK_DELAY), next.time());
        assertFalse(ScheduleCalculator.isExecutionDate(LocalDate.of(2026, 3, 15), list));
    }

    @Test
    void dayOfMonthMismatchStillRunsOnFilteredWeekday() {
        Period period = new Period(null, null, List.of("Monday"), "15");

        assertTrue(ScheduleCalculator.isExecutionDate(LocalDate.of(2026, 2, 16), period));
        assertFalse(ScheduleCalculator.isExecutionDate(LocalDate.of(2026, 2, 17), period));
    }

    @Test
    void futureStartDayIsFirstCandidate() {
        Period period = Period.everyDay("2026-03-01", "2026-12-31");

        assertEquals(Instant.parse("2026-03-01T02:00:00Z"),
                calculator.nextRunTime(Schedule.continuous("02:00:00", period), NOW));
    }

    @Test
    void exhaustedPeriodFallsBackToOneDayLater() {
        Period past = Period.everyDay("2025-01-01", "2025-12-31");

        ScheduleCalculator.NextRun next = calculator.nextRun(Schedule.continuous("02:00:00", past), NOW);

        assertTrue(next.fallback());
        assertEquals(Instant.parse("2026-02-11T10:00:00Z"), next.time());
    }

    @Test
    void malformedTimeFallsBack() {
        ScheduleCalculator.NextRun next = calculator.nextRun(Schedule.once("25:00:00"), NOW);

        assertTrue(next.fallback());
        assertNotNull(next.reason());
        assertEquals(NOW.plus(ScheduleCalculator.FALLBACK_DELAY), next.time());
    }

    @Test
    void continuousWithoutPeriodFallsBack() {
        ScheduleCalculator.NextRun next = calculator.nextRun(new Schedule("Continuous", "02:00:00", null), NOW);

        assertTrue(next.fallback());
    }

    @Test
    void unknownTypeFallsBack() {
        assertTrue(calculator.nextRun(new Schedule("Hourly", "02:00:00", null), NOW).fallback());
    }

    @Test
    void wallClockTimeIsInterpretedInConfiguredZone() {
        ScheduleCalculator berlin = new ScheduleCalculator(java.time.ZoneId.of("Europe/Berlin"));

        // 10:00Z is 11:00 in Berlin, so 12:00 local is still ahead today
        assertEquals(Instant.parse("2026-02-10T11:00:00Z"),
                berlin.nextRunTime(Schedule.once("12:00:00"), NOW));
    }

    @Test
    void parseTimeRejectsLooseFormats() {
        assertTrue(ScheduleCalculator.parseTime("02:00:00").isPresent());
        assertTrue(ScheduleCalculator.parseTime("2:00:00").isEmpty());
        assertTrue(ScheduleCalculator.parseTime("02:00").isEmpty());
        assertTrue(ScheduleCalculator.parseTime(null).isEmpty());
    }

    @Test
    void springForwardGapDoesNotShiftLaterRuns() {
        ScheduleCalculator newYork = new ScheduleCalculator(ZoneId.of("America/New_York"));
        Period mondays = new Period(null, null, List.of("Monday"), null);

        Instant continuous = newYork.nextRunTime(Schedule.continuous("02:30:00", mondays),
                Instant.parse("2026-03-08T06:00:00Z"));
        Instant once = newYork.nextRunTime(Schedule.once("02:30:00"), Instant.parse("2026-03-08T08:00:00Z"));

        assertEquals(Instant.parse("2026-03-09T06:30:00Z"), continuous);
        assertEquals(Instant.parse("2026-03-09T06:30:00Z"), once);
    }

    @Test
    void timeInsideGapRunsAfterTheGapThatDay() {
        ScheduleCalculator newYork = new ScheduleCalculator(ZoneId.of("America/New_York"));

        Instant next = newYork.nextRunTime(Schedule.once("02:30:00"), Instant.parse("2026-03-08T06:00:00Z"));

        assertEquals(Instant.parse("2026-03-08T07:30:00Z"), next);
    }
}
