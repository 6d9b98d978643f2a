package com.donorline.dispatch.scheduling;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of {@link BatchScheduler#schedule}. {@code scheduled} is in placement order,
 * {@code unscheduled} in the caller's input order, and {@code tasksPerDay} maps a
 * day index to the number of tasks this run placed on it.
 */
public record ScheduleResult<T>(
        List<ScheduledTask<T>> scheduled,
        List<SchedulableTask<T>> unscheduled,
        Map<Integer, Integer> tasksPerDay
) {

    public Optional<Instant> lastScheduledTime() {
        return scheduled.stream()
                .map(ScheduledTask::scheduledTime)
                .max(Instant::compareTo);
    }
}
