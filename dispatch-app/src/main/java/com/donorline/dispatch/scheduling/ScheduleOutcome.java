package com.donorline.dispatch.scheduling;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of scheduling (or rescheduling) a campaign's messages.
 *
 * @param scheduledForToday         sends on the current calendar day in the config's timezone
 * @param estimatedCompletionTime   time of the last scheduled send, null if nothing was scheduled
 * @param skipped                   messages without a credentialed sender, left pending
 * @param unscheduled               messages beyond the scheduling horizon, left pending
 */
public record ScheduleOutcome(
        int scheduled,
        int scheduledForToday,
        int scheduledForLater,
        Instant estimatedCompletionTime,
        List<SkippedMessage> skipped,
        List<UUID> unscheduled
) {

    public static ScheduleOutcome empty() {
        return new ScheduleOutcome(0, 0, 0, null, List.of(), List.of());
    }
}
