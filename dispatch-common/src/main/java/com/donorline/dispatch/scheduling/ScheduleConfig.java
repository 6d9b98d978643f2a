package com.donorline.dispatch.scheduling;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Sending rules of an organization (or a single campaign override).
 * <p>
 * Weekday indices run 0 (Sunday) to 6 (Saturday). Times are {@code H:MM} or
 * {@code HH:MM} strings. When {@code dailySchedules} holds an entry for a weekday,
 * that entry replaces the blanket {@code allowedDays}/time rules for the day.
 */
public record ScheduleConfig(
        int dailyLimit,
        int minGapMinutes,
        int maxGapMinutes,
        String timezone,
        Set<Integer> allowedDays,
        String allowedStartTime,
        String allowedEndTime,
        Map<Integer, DailySchedule> dailySchedules
) {

    public static final int MAX_DAILY_LIMIT = 500;

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]?[0-9]|2[0-3]):[0-5][0-9]$");

    public ScheduleConfig {
        allowedDays = allowedDays == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(allowedDays));
        dailySchedules = dailySchedules == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(dailySchedules));
    }

    /**
     * Organization defaults: 150 per day, 1–3 minutes apart, weekdays 09:00–17:00 New York time.
     */
    public static ScheduleConfig defaults() {
        return new ScheduleConfig(150, 1, 3, "America/New_York",
                Set.of(1, 2, 3, 4, 5), "09:00", "17:00", Map.of());
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    /**
     * Effective window for a weekday, or empty when sending is not allowed that day.
     */
    public Optional<DailyWindow> windowFor(int weekday) {
        DailySchedule override = dailySchedules.get(weekday);
        if (override != null) {
            if (!override.enabled()) {
                return Optional.empty();
            }
            String start = override.startTime() != null ? override.startTime() : allowedStartTime;
            String end = override.endTime() != null ? override.endTime() : allowedEndTime;
            return Optional.of(new DailyWindow(parseTime(start), parseTime(end)));
        }
        if (!allowedDays.contains(weekday)) {
            return Optional.empty();
        }
        return Optional.of(new DailyWindow(parseTime(allowedStartTime), parseTime(allowedEndTime)));
    }

    /**
     * Rejects the configuration with every violation found.
     *
     * @throws InvalidScheduleConfigException if any rule is broken
     */
    public ScheduleConfig validate() {
        List<String> violations = new ArrayList<>();

        if (dailyLimit < 1 || dailyLimit > MAX_DAILY_LIMIT) {
            violations.add("dailyLimit must be between 1 and " + MAX_DAILY_LIMIT);
        }
        if (minGapMinutes < 0) {
            violations.add("minGapMinutes must not be negative");
        }
        if (maxGapMinutes < minGapMinutes) {
            violations.add("maxGapMinutes must be greater than or equal to minGapMinutes");
        }
        if (timezone == null || !isValidZone(timezone)) {
            violations.add("timezone '" + timezone + "' is not a valid IANA zone");
        }
        if (allowedDays.isEmpty()) {
            violations.add("allowedDays must contain at least one day");
        }
        if (allowedDays.stream().anyMatch(day -> day == null || day < 0 || day > 6)) {
            violations.add("allowedDays must only contain values 0 (Sunday) to 6 (Saturday)");
        }
        checkRange("allowed", allowedStartTime, allowedEndTime, violations);

        dailySchedules.forEach((day, schedule) -> {
            if (day == null || day < 0 || day > 6) {
                violations.add("dailySchedules key " + day + " is not a weekday index");
                return;
            }
            if (schedule != null && schedule.enabled()) {
                String start = schedule.startTime() != null ? schedule.startTime() : allowedStartTime;
                String end = schedule.endTime() != null ? schedule.endTime() : allowedEndTime;
                checkRange("dailySchedules[" + day + "]", start, end, violations);
            }
        });

        if (!violations.isEmpty()) {
            throw new InvalidScheduleConfigException(violations);
        }
        return this;
    }

    private static void checkRange(String label, String start, String end, List<String> violations) {
        boolean startValid = isValidTime(start);
        boolean endValid = isValidTime(end);
        if (!startValid) {
            violations.add(label + " start time '" + start + "' must be HH:MM");
        }
        if (!endValid) {
            violations.add(label + " end time '" + end + "' must be HH:MM");
        }
        if (startValid && endValid && parseTime(start).isAfter(parseTime(end))) {
            violations.add(label + " start time must not be after end time");
        }
    }

    static boolean isValidTime(String value) {
        return value != null && TIME_PATTERN.matcher(value).matches();
    }

    static LocalTime parseTime(String value) {
        int colon = value.indexOf(':');
        return LocalTime.of(Integer.parseInt(value.substring(0, colon)), Integer.parseInt(value.substring(colon + 1)));
    }

    private static boolean isValidZone(String zone) {
        try {
            ZoneId.of(zone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }
}
