package com.donorline.dispatch.send;

import com.donorline.dispatch.identity.CredentialExpiredException;
import com.donorline.dispatch.identity.CredentialRefresher;
import com.donorline.dispatch.identity.IdentityRequest;
import com.donorline.dispatch.identity.NoIdentityAvailableException;
import com.donorline.dispatch.identity.SenderIdentity;
import com.donorline.dispatch.identity.SenderIdentityResolver;
import com.donorline.dispatch.messaging.DispatchEventPublisher;
import com.donorline.dispatch.model.Campaign;
import com.donorline.dispatch.model.CampaignMessage;
import com.donorline.dispatch.model.EmailSendJob;
import com.donorline.dispatch.model.JobStatus;
import com.donorline.dispatch.model.SendOutcome;
import com.donorline.dispatch.model.SendStatus;
import com.donorline.dispatch.model.dto.EmailSendEvent;
import com.donorline.dispatch.provider.EmailProvider;
import com.donorline.dispatch.provider.EmailProviderException;
import com.donorline.dispatch.provider.OutboundEmail;
import com.donorline.dispatch.repository.JobStore;
import com.donorline.dispatch.repository.JobUpdate;
import com.donorline.dispatch.repository.MessageUpdate;
import com.donorline.dispatch.tracking.InstrumentedContent;
import com.donorline.dispatch.tracking.TrackingInstrumenter;
import com.donorline.dispatch.tracking.TrackingRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Sends the message behind one job, at most once.
 * <p>
 * The job is claimed with a guarded {@code scheduled -> running} transition before
 * anything else happens; a repeated fire, or a fire racing a pause, loses that claim
 * and returns without side effects. Failures of a single message (no sender, expired
 * credential, provider error) are recorded on the job and message and reported as
 * {@link SendOutcome#FAILED}; they never abort the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendPipeline {

    static final String INTERRUPTED_SEND = "Interrupted send: an earlier attempt did not finish";

    private final JobStore jobStore;
    private final SenderIdentityResolver identityResolver;
    private final CredentialRefresher credentialRefresher;
    private final TrackingInstrumenter trackingInstrumenter;
    private final TrackingRecorder trackingRecorder;
    private final EmailProvider emailProvider;
    private final CampaignCompletionChecker completionChecker;
    private final DispatchEventPublisher eventPublisher;
    private final Clock clock;

    public SendOutcome sendJob(UUID jobId) {
        Optional<EmailSendJob> found = jobStore.findJob(jobId);
        if (found.isEmpty()) {
            log.error("Send fired for unknown job {}", jobId);
            return SendOutcome.FAILED;
        }
        EmailSendJob job = found.get();

        if (!jobStore.updateJobStatus(jobId, JobStatus.SCHEDULED, JobStatus.RUNNING, JobUpdate.claim())) {
            JobStatus current = jobStore.findJob(jobId).map(EmailSendJob::getStatus).orElse(job.getStatus());
            if (current == JobStatus.RUNNING) {
                return resolveInterrupted(job);
            }
            SendOutcome outcome = switch (current) {
                case CANCELLED -> SendOutcome.CANCELLED;
                case FAILED -> SendOutcome.FAILED;
                default -> SendOutcome.ALREADY_SENT;
            };
            log.info("Job {} already {}; ignoring fire ({})", jobId, current, outcome);
            return outcome;
        }

        Optional<CampaignMessage> foundMessage = jobStore.findMessage(job.getMessageId());
        if (foundMessage.isEmpty()) {
            log.error("Job {} points at missing message {}", jobId, job.getMessageId());
            jobStore.updateJobStatus(jobId, JobStatus.RUNNING, JobStatus.FAILED,
                    JobUpdate.failed("Message " + job.getMessageId() + " not found"));
            return SendOutcome.FAILED;
        }
        CampaignMessage message = foundMessage.get();

        if (message.isSent()) {
            return completeAlreadySent(job, message);
        }
        if (message.getSendStatus() == SendStatus.PAUSED || message.getSendStatus() == SendStatus.CANCELLED) {
            return cancelJob(job, message.getSendStatus());
        }
        if (!jobStore.updateMessageStatus(message.getId(), EnumSet.of(SendStatus.SCHEDULED), SendStatus.SENDING,
                MessageUpdate.none())) {
            CampaignMessage current = jobStore.findMessage(message.getId()).orElse(message);
            if (current.isSent()) {
                return completeAlreadySent(job, current);
            }
            return cancelJob(job, current.getSendStatus());
        }

        String providerMessageId;
        try {
            providerMessageId = deliver(job, message);
        } catch (NoIdentityAvailableException | CredentialExpiredException | EmailProviderException e) {
            log.warn("Send failed for job {} (message {}): {}", jobId, message.getId(), e.getMessage());
            return fail(job, message, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error sending job {} (message {})", jobId, message.getId(), e);
            return fail(job, message, "Unexpected error: " + e.getMessage());
        }

        Instant sentAt = clock.instant();
        if (!jobStore.markMessageSent(message.getId(), sentAt, providerMessageId)) {
            log.warn("Message {} was no longer sending when job {} recorded delivery", message.getId(), jobId);
        }
        jobStore.updateJobStatus(jobId, JobStatus.RUNNING, JobStatus.COMPLETED, JobUpdate.completed(sentAt));
        log.info("Sent message {} for job {} (provider id {})", message.getId(), jobId, providerMessageId);

        publish(job, SendOutcome.SENT, null);
        runCompletionCheck(job);
        return SendOutcome.SENT;
    }

    private String deliver(EmailSendJob job, CampaignMessage message) {
        UUID ownerUserId = jobStore.findCampaign(job.getCampaignId())
                .map(Campaign::getOwnerUserId)
                .orElse(null);
        SenderIdentity identity = identityResolver.resolve(
                new IdentityRequest(message.getDonorId(), job.getOrganizationId(), ownerUserId));
        identity = identity.withCredential(credentialRefresher.ensureFresh(identity.credential()));

        String trackingId = TrackingInstrumenter.newTrackingId();
        InstrumentedContent content = trackingInstrumenter.instrument(message.getBody(), trackingId);
        trackingRecorder.record(trackingId, message, content);

        OutboundEmail email = new OutboundEmail(message.getRecipientEmail(), message.getRecipientName(),
                message.getSubject(), content.html(), content.text());
        return emailProvider.deliver(email, identity);
    }

    /**
     * A job found {@code running} on a fire means an earlier attempt claimed it and
     * never finished. Delivery is not attempted again: a sent message completes the
     * job, anything else is failed so that retry-failed can pick it up.
     */
    private SendOutcome resolveInterrupted(EmailSendJob job) {
        Optional<CampaignMessage> found = jobStore.findMessage(job.getMessageId());
        if (found.isPresent() && found.get().isSent()) {
            return completeAlreadySent(job, found.get());
        }
        if (found.isPresent() && EnumSet.of(SendStatus.PAUSED, SendStatus.CANCELLED)
                .contains(found.get().getSendStatus())) {
            return cancelJob(job, found.get().getSendStatus());
        }
        log.warn("Job {} was left running by an earlier attempt; failing message {} without resending",
                job.getId(), job.getMessageId());
        return fail(job, EnumSet.of(SendStatus.SCHEDULED, SendStatus.SENDING), INTERRUPTED_SEND);
    }

    private SendOutcome completeAlreadySent(EmailSendJob job, CampaignMessage message) {
        Instant sentAt = message.getSentAt() != null ? message.getSentAt() : clock.instant();
        jobStore.updateJobStatus(job.getId(), JobStatus.RUNNING, JobStatus.COMPLETED, JobUpdate.completed(sentAt));
        log.info("Message {} already sent; job {} completed without sending", message.getId(), job.getId());
        return SendOutcome.ALREADY_SENT;
    }

    private SendOutcome cancelJob(EmailSendJob job, SendStatus messageStatus) {
        jobStore.updateJobStatus(job.getId(), JobStatus.RUNNING, JobStatus.CANCELLED, JobUpdate.none());
        log.info("Message {} is {}; job {} cancelled", job.getMessageId(), messageStatus, job.getId());
        return SendOutcome.CANCELLED;
    }

    private SendOutcome fail(EmailSendJob job, CampaignMessage message, String error) {
        return fail(job, EnumSet.of(SendStatus.SENDING), error);
    }

    private SendOutcome fail(EmailSendJob job, Set<SendStatus> messageExpected, String error) {
        jobStore.updateJobStatus(job.getId(), JobStatus.RUNNING, JobStatus.FAILED, JobUpdate.failed(error));
        jobStore.updateMessageStatus(job.getMessageId(), messageExpected, SendStatus.FAILED,
                MessageUpdate.failed(error));
        publish(job, SendOutcome.FAILED, error);
        runCompletionCheck(job);
        return SendOutcome.FAILED;
    }

    private void publish(EmailSendJob job, SendOutcome outcome, String error) {
        eventPublisher.publishSendEvent(new EmailSendEvent(job.getId(), job.getMessageId(), job.getCampaignId(),
                job.getOrganizationId(), outcome, error, clock.instant()));
    }

    private void runCompletionCheck(EmailSendJob job) {
        try {
            completionChecker.checkAndUpdate(job.getCampaignId());
        } catch (RuntimeException e) {
            // the stuck-campaign sweep picks this campaign up later
            log.warn("Completion check failed for campaign {} after job {}", job.getCampaignId(), job.getId(), e);
        }
    }
}
