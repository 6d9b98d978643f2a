package com.donorline.dispatch.scheduling;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Effective wall-clock window for one day. Both ends are inclusive at minute
 * granularity, so with an end of 17:00 the instant 17:00:59 is still inside.
 */
public record DailyWindow(LocalTime start, LocalTime end) {

    public boolean contains(LocalTime time) {
        LocalTime minute = time.truncatedTo(ChronoUnit.MINUTES);
        return !minute.isBefore(start) && !minute.isAfter(end);
    }
}
