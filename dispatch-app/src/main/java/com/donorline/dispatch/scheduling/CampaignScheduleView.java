package com.donorline.dispatch.scheduling;

import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.model.JobStatus;
import com.donorline.dispatch.model.SendStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only report of a campaign's sending schedule.
 */
public record CampaignScheduleView(
        UUID campaignId,
        String organizationId,
        String name,
        CampaignStatus status,
        Map<SendStatus, Long> messageCounts,
        Map<JobStatus, Long> jobCounts,
        List<ScheduledJob> jobs,
        Instant nextSendTime,
        Instant lastSendTime,
        Instant estimatedCompletionTime
) {

    public record ScheduledJob(
            UUID jobId,
            UUID messageId,
            JobStatus status,
            Instant scheduledTime,
            Instant actualSendTime,
            int attemptCount,
            String lastError
    ) {
    }
}
