package com.donorline.dispatch.scheduling;

/**
 * Per-weekday override of the blanket sending window. A missing start or end time
 * falls back to the blanket value of the owning {@link ScheduleConfig}.
 */
public record DailySchedule(String startTime, String endTime, boolean enabled) {

    public static DailySchedule disabled() {
        return new DailySchedule(null, null, false);
    }
}
