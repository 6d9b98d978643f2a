package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.Campaign;
import com.donorline.dispatch.model.CampaignMessage;
import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.model.EmailSendJob;
import com.donorline.dispatch.model.JobStatus;
import com.donorline.dispatch.model.SendStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * {@link JobStore} on Spring Data JPA. Guarded transitions run as a single
 * {@code UPDATE ... WHERE status = :expected}; the accompanying fields are written in
 * the same transaction only when that update hit the row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaJobStore implements JobStore {

    private final EmailSendJobRepository jobRepository;
    private final CampaignMessageRepository messageRepository;
    private final CampaignRepository campaignRepository;

    @Override
    @Transactional
    public List<EmailSendJob> createJobs(List<EmailSendJob> jobs) {
        return jobRepository.saveAll(jobs);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EmailSendJob> findJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmailSendJob> getJobsByStatus(UUID campaignId, JobStatus status) {
        return jobRepository.findByCampaignIdAndStatusOrderByScheduledTimeAsc(campaignId, status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmailSendJob> getJobsByCampaign(UUID campaignId) {
        return jobRepository.findByCampaignIdOrderByScheduledTimeAsc(campaignId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmailSendJob> getOrganizationJobs(String organizationId, Set<JobStatus> statuses, Instant since) {
        return jobRepository.findByOrganizationIdAndStatusInAndScheduledTimeGreaterThanEqual(
                organizationId, statuses, since);
    }

    @Override
    @Transactional
    public boolean updateJobStatus(UUID jobId, JobStatus expected, JobStatus next, JobUpdate fields) {
        if (jobRepository.transition(jobId, expected, next) == 0) {
            log.debug("Job {} not in {}; skipped transition to {}", jobId, expected, next);
            return false;
        }
        jobRepository.findById(jobId).ifPresent(job -> {
            if (fields.incrementAttempt()) {
                job.setAttemptCount(job.getAttemptCount() + 1);
            }
            if (fields.actualSendTime() != null) {
                job.setActualSendTime(fields.actualSendTime());
            }
            if (fields.lastError() != null) {
                job.setLastError(fields.lastError());
            }
            jobRepository.save(job);
        });
        return true;
    }

    @Override
    @Transactional
    public void attachTrigger(UUID jobId, String triggerHandle) {
        jobRepository.findById(jobId).ifPresent(job -> {
            job.setTriggerHandle(triggerHandle);
            jobRepository.save(job);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<CampaignMessage> getMessagesByStatus(UUID campaignId, SendStatus status) {
        return messageRepository.findByCampaignIdAndSendStatusAndSentFalseOrderByCreatedAtAsc(campaignId, status);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CampaignMessage> findMessage(UUID messageId) {
        return messageRepository.findById(messageId);
    }

    @Override
    @Transactional
    public boolean updateMessageStatus(UUID messageId, Set<SendStatus> expected, SendStatus next,
                                       MessageUpdate fields) {
        if (messageRepository.transition(messageId, expected, next) == 0) {
            log.debug("Message {} not in {}; skipped transition to {}", messageId, expected, next);
            return false;
        }
        messageRepository.findById(messageId).ifPresent(message -> {
            if (fields.clearSchedule()) {
                message.setSendJobId(null);
                message.setScheduledSendTime(null);
            }
            if (fields.sendJobId() != null) {
                message.setSendJobId(fields.sendJobId());
            }
            if (fields.scheduledSendTime() != null) {
                message.setScheduledSendTime(fields.scheduledSendTime());
            }
            if (fields.lastError() != null) {
                message.setLastError(fields.lastError());
            }
            messageRepository.save(message);
        });
        return true;
    }

    @Override
    @Transactional
    public boolean markMessageSent(UUID messageId, Instant sentAt, String providerMessageId) {
        return messageRepository.markSent(messageId, SendStatus.SENDING, SendStatus.SENT,
                sentAt, providerMessageId) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<SendStatus, Long> getCampaignMessageCounts(UUID campaignId) {
        Map<SendStatus, Long> counts = new EnumMap<>(SendStatus.class);
        for (Object[] row : messageRepository.countByStatus(campaignId)) {
            counts.put((SendStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Campaign> findCampaign(UUID campaignId) {
        return campaignRepository.findById(campaignId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Campaign> findCampaigns(String organizationId, Set<CampaignStatus> statuses) {
        return campaignRepository.findByOrganizationIdAndStatusIn(organizationId, statuses);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findOrganizationsWithCampaigns(Set<CampaignStatus> statuses) {
        return campaignRepository.findOrganizationIdsWithStatusIn(statuses);
    }

    @Override
    @Transactional
    public void updateCampaignStatus(UUID campaignId, CampaignStatus status) {
        campaignRepository.findById(campaignId).ifPresent(campaign -> {
            campaign.setStatus(status);
            campaignRepository.save(campaign);
        });
    }

    @Override
    @Transactional
    public void saveCampaignScheduleConfig(UUID campaignId, String scheduleConfigJson) {
        campaignRepository.findById(campaignId).ifPresent(campaign -> {
            campaign.setScheduleConfig(scheduleConfigJson);
            campaignRepository.save(campaign);
        });
    }
}
