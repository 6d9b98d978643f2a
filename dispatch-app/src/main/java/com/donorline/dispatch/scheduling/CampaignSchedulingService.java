package com.donorline.dispatch.scheduling;

import com.donorline.dispatch.exception.CampaignNotFoundException;
import com.donorline.dispatch.identity.IdentityRequest;
import com.donorline.dispatch.identity.SenderIdentityResolver;
import com.donorline.dispatch.messaging.DispatchEventPublisher;
import com.donorline.dispatch.model.Campaign;
import com.donorline.dispatch.model.CampaignMessage;
import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.model.EmailSendJob;
import com.donorline.dispatch.model.JobStatus;
import com.donorline.dispatch.model.SendStatus;
import com.donorline.dispatch.model.dto.CampaignStatusEvent;
import com.donorline.dispatch.repository.JobStore;
import com.donorline.dispatch.repository.JobUpdate;
import com.donorline.dispatch.repository.MessageUpdate;
import com.donorline.dispatch.send.CampaignCompletionChecker;
import com.donorline.dispatch.trigger.JobTriggerGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a campaign's pending messages into scheduled send jobs and drives pause,
 * resume, cancel and retry.
 * <p>
 * Each message/job pair is written on its own (job, then message, then trigger), so a
 * crash mid-batch leaves already-written pairs scheduled and the rest pending for the
 * next run.
 */
@Component
@Profile("service")
@Slf4j
public class CampaignSchedulingService {

    /** Jobs that use up a day's quota for the organization. */
    private static final Set<JobStatus> QUOTA_STATUSES = EnumSet.of(JobStatus.SCHEDULED, JobStatus.RUNNING, JobStatus.COMPLETED);

    private final JobStore jobStore;
    private final JobTriggerGateway triggerGateway;
    private final BatchScheduler batchScheduler;
    private final ScheduleSettingsService settingsService;
    private final ScheduleConfigMapper configMapper;
    private final SenderIdentityResolver identityResolver;
    private final CampaignCompletionChecker completionChecker;
    private final DispatchEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxDays;

    public CampaignSchedulingService(
            JobStore jobStore,
            JobTriggerGateway triggerGateway,
            BatchScheduler batchScheduler,
            ScheduleSettingsService settingsService,
            ScheduleConfigMapper configMapper,
            SenderIdentityResolver identityResolver,
            CampaignCompletionChecker completionChecker,
            DispatchEventPublisher eventPublisher,
            Clock clock,
            @Value("${dispatch.scheduling.max-days:365}") int maxDays) {
        this.jobStore = jobStore;
        this.triggerGateway = triggerGateway;
        this.batchScheduler = batchScheduler;
        this.settingsService = settingsService;
        this.configMapper = configMapper;
        this.identityResolver = identityResolver;
        this.completionChecker = completionChecker;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxDays = maxDays;
    }

    public ScheduleOutcome scheduleEmailCampaign(UUID campaignId) {
        return scheduleEmailCampaign(campaignId, null);
    }

    /**
     * Schedules every pending message of the campaign.
     *
     * @param override campaign-specific rules; stored on the campaign and reused by
     *                 resume and retry. {@code null} keeps the current rules.
     * @throws InvalidScheduleConfigException if the rules are invalid; nothing is written
     */
    public ScheduleOutcome scheduleEmailCampaign(UUID campaignId, ScheduleConfig override) {
        Campaign campaign = requireCampaign(campaignId);
        ScheduleConfig config;
        if (override != null) {
            config = override.validate();
            jobStore.saveCampaignScheduleConfig(campaignId, configMapper.toJson(override));
        } else {
            config = effectiveConfig(campaign).validate();
        }
        List<CampaignMessage> pending = jobStore.getMessagesByStatus(campaignId, SendStatus.PENDING);
        log.info("Scheduling {} pending messages for campaign {}", pending.size(), campaignId);
        return schedule(campaign, config, pending);
    }

    /**
     * Withdraws every job that has not fired yet. Jobs already running or finished are
     * left alone, so a second call cancels nothing.
     */
    public PauseOutcome pauseCampaign(UUID campaignId) {
        Campaign campaign = requireCampaign(campaignId);
        int cancelled = withdrawScheduledJobs(campaign, SendStatus.PAUSED);
        if (cancelled > 0) {
            changeStatus(campaign, CampaignStatus.PAUSED);
        }
        log.info("Paused campaign {}: {} jobs cancelled", campaignId, cancelled);
        return new PauseOutcome(cancelled);
    }

    /**
     * Reschedules exactly the messages that are paused.
     */
    public ScheduleOutcome resumeCampaign(UUID campaignId) {
        Campaign campaign = requireCampaign(campaignId);
        ScheduleConfig config = effectiveConfig(campaign).validate();
        List<CampaignMessage> reset = resetToPending(campaignId, SendStatus.PAUSED);
        log.info("Resuming campaign {} with {} paused messages", campaignId, reset.size());
        return schedule(campaign, config, reset);
    }

    /**
     * Pauses the campaign, then cancels every message that has not started sending.
     * Cancelled messages cannot be resumed.
     */
    public CancelOutcome cancelCampaign(UUID campaignId) {
        Campaign campaign = requireCampaign(campaignId);
        int cancelledJobs = withdrawScheduledJobs(campaign, SendStatus.PAUSED);

        int cancelledEmails = 0;
        for (SendStatus status : SendStatus.CANCELLABLE) {
            for (CampaignMessage message : jobStore.getMessagesByStatus(campaignId, status)) {
                if (jobStore.updateMessageStatus(message.getId(), SendStatus.CANCELLABLE,
                        SendStatus.CANCELLED, MessageUpdate.none())) {
                    cancelledEmails++;
                }
            }
        }
        log.info("Cancelled campaign {}: {} jobs, {} messages", campaignId, cancelledJobs, cancelledEmails);
        completionChecker.checkAndUpdate(campaignId);
        return new CancelOutcome(cancelledJobs, cancelledEmails);
    }

    /**
     * Operator retry: failed messages go back to pending and are scheduled again.
     */
    public ScheduleOutcome retryFailedMessages(UUID campaignId) {
        Campaign campaign = requireCampaign(campaignId);
        ScheduleConfig config = effectiveConfig(campaign).validate();
        List<CampaignMessage> reset = resetToPending(campaignId, SendStatus.FAILED);
        log.info("Retrying {} failed messages of campaign {}", reset.size(), campaignId);
        return schedule(campaign, config, reset);
    }

    /**
     * Re-plans the not-yet-fired sends of an organization's running campaigns after its
     * rules changed. Campaigns with their own rules are left as they are.
     *
     * @return the number of messages scheduled again
     */
    public int rescheduleOrganization(String organizationId) {
        ScheduleConfig config = settingsService.getOrCreate(organizationId).validate();
        int rescheduled = 0;
        for (Campaign campaign : jobStore.findCampaigns(organizationId, EnumSet.of(CampaignStatus.RUNNING))) {
            if (campaign.getScheduleConfig() != null) {
                log.debug("Campaign {} has its own schedule config; not rescheduling", campaign.getId());
                continue;
            }
            int withdrawn = withdrawScheduledJobs(campaign, SendStatus.PENDING);
            if (withdrawn == 0) {
                continue;
            }
            List<CampaignMessage> pending = jobStore.getMessagesByStatus(campaign.getId(), SendStatus.PENDING);
            rescheduled += schedule(campaign, config, pending).scheduled();
        }
        log.info("Rescheduled {} messages for organization {}", rescheduled, organizationId);
        return rescheduled;
    }

    public CampaignScheduleView getCampaignSchedule(UUID campaignId) {
        Campaign campaign = requireCampaign(campaignId);
        List<EmailSendJob> jobs = jobStore.getJobsByCampaign(campaignId);

        Map<JobStatus, Long> jobCounts = jobs.stream()
                .collect(Collectors.groupingBy(EmailSendJob::getStatus,
                        () -> new EnumMap<>(JobStatus.class), Collectors.counting()));
        List<EmailSendJob> pendingJobs = jobs.stream()
                .filter(job -> job.getStatus() == JobStatus.SCHEDULED)
                .toList();

        Instant next = pendingJobs.stream().map(EmailSendJob::getScheduledTime).min(Comparator.naturalOrder()).orElse(null);
        Instant estimatedCompletion = pendingJobs.stream().map(EmailSendJob::getScheduledTime).max(Comparator.naturalOrder()).orElse(null);
        Instant lastSent = jobs.stream()
                .map(EmailSendJob::getActualSendTime)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        List<CampaignScheduleView.ScheduledJob> jobViews = jobs.stream()
                .map(job -> new CampaignScheduleView.ScheduledJob(job.getId(), job.getMessageId(), job.getStatus(),
                        job.getScheduledTime(), job.getActualSendTime(), job.getAttemptCount(), job.getLastError()))
                .toList();

        return new CampaignScheduleView(campaign.getId(), campaign.getOrganizationId(), campaign.getName(),
                campaign.getStatus(), jobStore.getCampaignMessageCounts(campaignId), jobCounts, jobViews,
                next, lastSent, estimatedCompletion);
    }

    private ScheduleOutcome schedule(Campaign campaign, ScheduleConfig config, List<CampaignMessage> messages) {
        if (messages.isEmpty()) {
            return ScheduleOutcome.empty();
        }
        Instant now = clock.instant();

        List<SkippedMessage> skipped = new ArrayList<>();
        List<SchedulableTask<CampaignMessage>> tasks = new ArrayList<>();
        for (CampaignMessage message : messages) {
            IdentityRequest request = new IdentityRequest(message.getDonorId(), campaign.getOrganizationId(),
                    campaign.getOwnerUserId());
            if (identityResolver.tryResolve(request).isEmpty()) {
                log.warn("Skipping message {} of campaign {}: no credentialed sender for donor {}",
                        message.getId(), campaign.getId(), message.getDonorId());
                skipped.add(new SkippedMessage(message.getId(), "No credentialed sender available"));
                continue;
            }
            tasks.add(new SchedulableTask<>(message.getId().toString(), message, message.getPriority()));
        }

        Map<LocalDate, Integer> usage = organizationUsage(campaign.getOrganizationId(), config, now);
        ScheduleResult<CampaignMessage> result = batchScheduler.schedule(tasks, config, now, maxDays, usage);

        ZoneId zone = config.zoneId();
        LocalDate today = now.atZone(zone).toLocalDate();
        int scheduled = 0;
        int scheduledForToday = 0;
        Instant lastSendTime = null;
        for (ScheduledTask<CampaignMessage> task : result.scheduled()) {
            if (!persistAndTrigger(campaign, task)) {
                continue;
            }
            scheduled++;
            if (task.scheduledTime().atZone(zone).toLocalDate().equals(today)) {
                scheduledForToday++;
            }
            if (lastSendTime == null || task.scheduledTime().isAfter(lastSendTime)) {
                lastSendTime = task.scheduledTime();
            }
        }

        List<UUID> unscheduled = result.unscheduled().stream()
                .map(task -> task.payload().getId())
                .toList();
        if (!unscheduled.isEmpty()) {
            log.warn("{} messages of campaign {} did not fit within {} days and stay pending",
                    unscheduled.size(), campaign.getId(), maxDays);
        }
        if (scheduled > 0) {
            changeStatus(campaign, CampaignStatus.RUNNING);
        }
        log.info("Campaign {}: {} scheduled ({} today), {} skipped, {} unscheduled, last send at {}",
                campaign.getId(), scheduled, scheduledForToday, skipped.size(), unscheduled.size(), lastSendTime);
        return new ScheduleOutcome(scheduled, scheduledForToday, scheduled - scheduledForToday, lastSendTime,
                List.copyOf(skipped), unscheduled);
    }

    private boolean persistAndTrigger(Campaign campaign, ScheduledTask<CampaignMessage> task) {
        CampaignMessage message = task.task().payload();
        EmailSendJob job = EmailSendJob.builder()
                .id(UUID.randomUUID())
                .messageId(message.getId())
                .campaignId(campaign.getId())
                .organizationId(campaign.getOrganizationId())
                .scheduledTime(task.scheduledTime())
                .status(JobStatus.SCHEDULED)
                .build();
        jobStore.createJobs(List.of(job));

        if (!jobStore.updateMessageStatus(message.getId(), EnumSet.of(SendStatus.PENDING), SendStatus.SCHEDULED,
                MessageUpdate.scheduled(job.getId(), task.scheduledTime()))) {
            log.info("Message {} left pending while scheduling; dropping job {}", message.getId(), job.getId());
            jobStore.updateJobStatus(job.getId(), JobStatus.SCHEDULED, JobStatus.CANCELLED, JobUpdate.none());
            return false;
        }

        try {
            String handle = triggerGateway.scheduleCallback(job.getId(), task.scheduledTime());
            jobStore.attachTrigger(job.getId(), handle);
            return true;
        } catch (RuntimeException e) {
            log.error("Trigger registration failed for job {} (message {})", job.getId(), message.getId(), e);
            jobStore.updateJobStatus(job.getId(), JobStatus.SCHEDULED, JobStatus.FAILED,
                    JobUpdate.failed("Trigger registration failed: " + e.getMessage()));
            jobStore.updateMessageStatus(message.getId(), EnumSet.of(SendStatus.SCHEDULED), SendStatus.PENDING,
                    MessageUpdate.unscheduled());
            return false;
        }
    }

    /**
     * Cancels every scheduled job of the campaign and moves its message to
     * {@code messageStatus}. A job is only touched if this call wins the
     * {@code scheduled -> cancelled} transition, so a job the pipeline has already
     * claimed is never interfered with.
     */
    private int withdrawScheduledJobs(Campaign campaign, SendStatus messageStatus) {
        MessageUpdate messageUpdate = messageStatus == SendStatus.PENDING ? MessageUpdate.unscheduled() : MessageUpdate.none();
        int cancelled = 0;
        for (EmailSendJob job : jobStore.getJobsByStatus(campaign.getId(), JobStatus.SCHEDULED)) {
            if (!jobStore.updateJobStatus(job.getId(), JobStatus.SCHEDULED, JobStatus.CANCELLED, JobUpdate.none())) {
                continue;
            }
            cancelTrigger(job);
            jobStore.updateMessageStatus(job.getMessageId(), EnumSet.of(SendStatus.SCHEDULED), messageStatus, messageUpdate);
            cancelled++;
        }
        return cancelled;
    }

    private void cancelTrigger(EmailSendJob job) {
        if (job.getTriggerHandle() == null) {
            log.warn("Job {} has no trigger handle; its fire will find the job cancelled", job.getId());
            return;
        }
        try {
            triggerGateway.cancel(job.getTriggerHandle());
        } catch (RuntimeException e) {
            log.warn("Could not cancel trigger {} of job {}; its fire will find the job cancelled",
                    job.getTriggerHandle(), job.getId(), e);
        }
    }

    private List<CampaignMessage> resetToPending(UUID campaignId, SendStatus from) {
        List<CampaignMessage> reset = new ArrayList<>();
        for (CampaignMessage message : jobStore.getMessagesByStatus(campaignId, from)) {
            if (jobStore.updateMessageStatus(message.getId(), EnumSet.of(from), SendStatus.PENDING,
                    MessageUpdate.unscheduled())) {
                message.setSendStatus(SendStatus.PENDING);
                message.setSendJobId(null);
                message.setScheduledSendTime(null);
                reset.add(message);
            }
        }
        return reset;
    }

    /**
     * Sends already booked per local day for the organization, from today onward.
     */
    private Map<LocalDate, Integer> organizationUsage(String organizationId, ScheduleConfig config, Instant now) {
        ZoneId zone = config.zoneId();
        Instant startOfToday = now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
        return jobStore.getOrganizationJobs(organizationId, QUOTA_STATUSES, startOfToday).stream()
                .collect(Collectors.groupingBy(job -> job.getScheduledTime().atZone(zone).toLocalDate(),
                        Collectors.summingInt(job -> 1)));
    }

    private ScheduleConfig effectiveConfig(Campaign campaign) {
        if (campaign.getScheduleConfig() != null) {
            return configMapper.fromJson(campaign.getScheduleConfig());
        }
        return settingsService.getOrCreate(campaign.getOrganizationId());
    }

    private void changeStatus(Campaign campaign, CampaignStatus status) {
        if (campaign.getStatus() == status) {
            return;
        }
        jobStore.updateCampaignStatus(campaign.getId(), status);
        campaign.setStatus(status);
        eventPublisher.publishCampaignStatus(
                new CampaignStatusEvent(campaign.getId(), campaign.getOrganizationId(), status, clock.instant()));
    }

    private Campaign requireCampaign(UUID campaignId) {
        return jobStore.findCampaign(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }
}
