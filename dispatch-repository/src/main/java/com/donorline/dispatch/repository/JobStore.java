package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.Campaign;
import com.donorline.dispatch.model.CampaignMessage;
import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.model.EmailSendJob;
import com.donorline.dispatch.model.JobStatus;
import com.donorline.dispatch.model.SendStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence gateway for send jobs, campaign messages and campaign status.
 * <p>
 * Status updates are guarded: they only apply when the row is still in the expected
 * prior status, and report whether they did. Callers rely on that to make duplicate
 * trigger fires and pause/fire races harmless.
 */
public interface JobStore {

    List<EmailSendJob> createJobs(List<EmailSendJob> jobs);

    Optional<EmailSendJob> findJob(UUID jobId);

    List<EmailSendJob> getJobsByStatus(UUID campaignId, JobStatus status);

    /** All jobs of a campaign ordered by scheduled time. */
    List<EmailSendJob> getJobsByCampaign(UUID campaignId);

    /** Jobs of an organization in the given statuses scheduled at or after {@code since}. */
    List<EmailSendJob> getOrganizationJobs(String organizationId, Set<JobStatus> statuses, Instant since);

    /**
     * @return true if the job was in {@code expected} and is now {@code next}
     */
    boolean updateJobStatus(UUID jobId, JobStatus expected, JobStatus next, JobUpdate fields);

    void attachTrigger(UUID jobId, String triggerHandle);

    /** Unsent messages of a campaign in the given status, oldest first. */
    List<CampaignMessage> getMessagesByStatus(UUID campaignId, SendStatus status);

    Optional<CampaignMessage> findMessage(UUID messageId);

    /**
     * @return true if the message was unsent, in one of {@code expected}, and is now {@code next}
     */
    boolean updateMessageStatus(UUID messageId, Set<SendStatus> expected, SendStatus next, MessageUpdate fields);

    /**
     * Records provider acceptance: {@code sending -> sent} with the sent flag set.
     *
     * @return false if the message was already sent or no longer sending
     */
    boolean markMessageSent(UUID messageId, Instant sentAt, String providerMessageId);

    Map<SendStatus, Long> getCampaignMessageCounts(UUID campaignId);

    Optional<Campaign> findCampaign(UUID campaignId);

    List<Campaign> findCampaigns(String organizationId, Set<CampaignStatus> statuses);

    List<String> findOrganizationsWithCampaigns(Set<CampaignStatus> statuses);

    void updateCampaignStatus(UUID campaignId, CampaignStatus status);

    void saveCampaignScheduleConfig(UUID campaignId, String scheduleConfigJson);
}
