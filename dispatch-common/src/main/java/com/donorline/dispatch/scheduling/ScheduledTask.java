package com.donorline.dispatch.scheduling;

import java.time.Instant;

/**
 * A task with its assigned send time and the scheduling day (0 = first) it landed on.
 */
public record ScheduledTask<T>(SchedulableTask<T> task, Instant scheduledTime, int dayIndex) {
}
