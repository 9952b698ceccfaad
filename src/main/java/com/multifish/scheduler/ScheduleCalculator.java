package com.multifish.scheduler;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * Computes the next execution instant of a {@link Schedule}. Stateless: the
 * result depends only on the schedule, {@code now} and the zone wall-clock
 * times are interpreted in.
 */
public class ScheduleCalculator {

    static final int LOOKAHEAD_DAYS = 365;
    static final Duration FALLBACK_DELAY = Duration.ofHours(24);

    static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private final ZoneId zone;

    public ScheduleCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Next run time, or {@code now + 24h} flagged as a fallback when the schedule
     * cannot produce one.
     */
    public NextRun nextRun(Schedule schedule, Instant now) {
        Optional<LocalTime> time = parseTime(schedule.time());
        if (time.isEmpty()) {
            return NextRun.fallback(now, "unparseable schedule time '" + schedule.time() + "'");
        }
        Optional<ScheduleType> type = schedule.scheduleType();
        if (type.isEmpty()) {
            return NextRun.fallback(now, "unknown schedule type '" + schedule.type() + "'");
        }
        return switch (type.get()) {
            case ONCE -> NextRun.at(nextOnce(time.get(), now));
            case CONTINUOUS -> nextContinuous(schedule.period(), time.get(), now);
        };
    }

    public Instant nextRunTime(Schedule schedule, Instant now) {
        return nextRun(schedule, now).time();
    }

    private Instant nextOnce(LocalTime time, Instant now) {
        LocalDate date = LocalDate.ofInstant(now, zone);
        if (!at(date, time).isAfter(now)) {
            date = date.plusDays(1);
        }
        return at(date, time);
    }

    private NextRun nextContinuous(Period period, LocalTime time, Instant now) {
        if (period == null) {
            return NextRun.fallback(now, "continuous schedule without a period");
        }

        LocalDate startDate = LocalDate.ofInstant(now, zone);
        Optional<LocalDate> startDay = parseDate(period.startDay());
        if (startDay.isPresent() && startDay.get().isAfter(startDate)) {
            startDate = startDay.get();
        }

        LocalDate date = startDate;
        if (!at(date, time).isAfter(now)) {
            date = date.plusDays(1);
        }

        for (int i = 0; i < LOOKAHEAD_DAYS; i++) {
            if (isExecutionDate(date, period)) {
                return NextRun.at(at(date, time));
            }
            date = date.plusDays(1);
        }
        return NextRun.fallback(now, "no matching day within " + LOOKAHEAD_DAYS + " days");
    }

    /**
     * Wall-clock time on the given date. A time inside a DST gap moves forward by
     * the gap length for that date only.
     */
    private Instant at(LocalDate date, LocalTime time) {
        return date.atTime(time).atZone(zone).toInstant();
    }

    /**
     * Period predicate. When DaysOfMonth is set it is compared to the day number
     * as a whole string, so a list such as "1,15" never matches.
     */
    static boolean isExecutionDate(LocalDate date, Period period) {
        Optional<LocalDate> startDay = parseDate(period.startDay());
        if (startDay.isPresent() && date.isBefore(startDay.get())) {
            return false;
        }
        Optional<LocalDate> endDay = parseDate(period.endDay());
        if (endDay.isPresent() && date.isAfter(endDay.get())) {
            return false;
        }

        if (!period.daysOfWeek().isEmpty()) {
            String weekday = date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            if (!period.daysOfWeek().contains(weekday)) {
                return false;
            }
        }

        if (period.hasDaysOfMonth()) {
            if (period.daysOfMonth().equals(String.valueOf(date.getDayOfMonth()))) {
                return true;
            }
            return !period.daysOfWeek().isEmpty();
        }
        return true;
    }

    static Optional<LocalTime> parseTime(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(LocalTime.parse(value, TIME_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalDate> parseDate(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public record NextRun(Instant time, boolean fallback, String reason) {

        static NextRun at(Instant time) {
            return new NextRun(time, false, null);
        }

        static NextRun fallback(Instant now, String reason) {
            return new NextRun(now.plus(FALLBACK_DELAY), true, reason);
        }
    }
}
