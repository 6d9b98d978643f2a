package com.donorline.dispatch.scheduling;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Decides whether an instant falls inside a configured sending window and finds the
 * next instant that does. All calendar math happens in the config's timezone: each
 * candidate is built from wall-clock components with {@link ZonedDateTime#of}, so a
 * DST change never moves a 09:00 start to 08:00 or 10:00.
 */
public class TimeWindowEvaluator {

    /** How far ahead {@link #nextAllowedDay} looks before giving up. */
    public static final int SEARCH_HORIZON_DAYS = 365;

    public boolean isAllowed(Instant instant, ScheduleConfig config) {
        ZonedDateTime local = instant.atZone(config.zoneId());
        return config.windowFor(weekdayIndex(local.getDayOfWeek()))
                .map(window -> window.contains(local.toLocalTime()))
                .orElse(false);
    }

    /**
     * Earliest allowed instant at or after {@code instant}. Empty means no day in the
     * search horizon permits sending; callers treat that as "cannot schedule".
     */
    public Optional<Instant> nextAllowed(Instant instant, ScheduleConfig config) {
        if (isAllowed(instant, config)) {
            return Optional.of(instant);
        }
        ZoneId zone = config.zoneId();
        ZonedDateTime local = instant.atZone(zone);
        LocalDate today = local.toLocalDate();

        Optional<DailyWindow> todaysWindow = windowFor(today, config);
        if (todaysWindow.isPresent() && local.toLocalTime().isBefore(todaysWindow.get().start())) {
            Instant start = ZonedDateTime.of(today, todaysWindow.get().start(), zone).toInstant();
            if (!start.isBefore(instant) && isAllowed(start, config)) {
                return Optional.of(start);
            }
        }
        return nextAllowedDay(instant, config);
    }

    /**
     * Start of the first allowed window on a local date strictly after the date of
     * {@code instant}.
     */
    public Optional<Instant> nextAllowedDay(Instant instant, ScheduleConfig config) {
        ZoneId zone = config.zoneId();
        LocalDate date = instant.atZone(zone).toLocalDate();
        for (int i = 1; i <= SEARCH_HORIZON_DAYS; i++) {
            LocalDate candidateDate = date.plusDays(i);
            Optional<DailyWindow> window = windowFor(candidateDate, config);
            if (window.isEmpty()) {
                continue;
            }
            Instant candidate = ZonedDateTime.of(candidateDate, window.get().start(), zone).toInstant();
            if (isAllowed(candidate, config)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public Optional<DailyWindow> windowFor(LocalDate date, ScheduleConfig config) {
        return config.windowFor(weekdayIndex(date.getDayOfWeek()));
    }

    /** 0 = Sunday ... 6 = Saturday. */
    public static int weekdayIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }
}
