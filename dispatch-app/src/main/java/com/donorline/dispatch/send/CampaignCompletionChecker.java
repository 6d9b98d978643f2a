package com.donorline.dispatch.send;

import com.donorline.dispatch.messaging.DispatchEventPublisher;
import com.donorline.dispatch.model.Campaign;
import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.model.SendStatus;
import com.donorline.dispatch.model.dto.CampaignStatusEvent;
import com.donorline.dispatch.repository.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves a campaign to its final status once none of its messages can still be sent.
 * <p>
 * Final status: {@code CANCELLED} if any message was cancelled, otherwise
 * {@code COMPLETED_WITH_ERRORS} if any failed, otherwise {@code COMPLETED}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignCompletionChecker {

    private final JobStore jobStore;
    private final DispatchEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @return the campaign's final status if it is finished, empty while messages are
     *         still open or the campaign has none
     */
    public Optional<CampaignStatus> checkAndUpdate(UUID campaignId) {
        Optional<CampaignStatus> finalStatus = evaluate(jobStore.getCampaignMessageCounts(campaignId));
        if (finalStatus.isEmpty()) {
            return Optional.empty();
        }
        Optional<Campaign> campaign = jobStore.findCampaign(campaignId);
        if (campaign.isEmpty()) {
            log.warn("Completion check for unknown campaign {}", campaignId);
            return Optional.empty();
        }
        CampaignStatus status = finalStatus.get();
        if (campaign.get().getStatus() != status) {
            jobStore.updateCampaignStatus(campaignId, status);
            eventPublisher.publishCampaignStatus(
                    new CampaignStatusEvent(campaignId, campaign.get().getOrganizationId(), status, clock.instant()));
            log.info("Campaign {} finished: {} -> {}", campaignId, campaign.get().getStatus(), status);
        }
        return finalStatus;
    }

    /**
     * Re-runs the check for every campaign of the organization that still looks active.
     *
     * @return how many campaigns were moved to a final status
     */
    public int fixStuckCampaigns(String organizationId) {
        int fixed = 0;
        for (Campaign campaign : jobStore.findCampaigns(organizationId, CampaignStatus.REPAIRABLE)) {
            if (checkAndUpdate(campaign.getId()).isPresent()) {
                log.info("Repaired stuck campaign {} (was {})", campaign.getId(), campaign.getStatus());
                fixed++;
            }
        }
        return fixed;
    }

    static Optional<CampaignStatus> evaluate(Map<SendStatus, Long> counts) {
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        if (total == 0) {
            return Optional.empty();
        }
        boolean open = SendStatus.OPEN.stream().anyMatch(status -> counts.getOrDefault(status, 0L) > 0);
        if (open) {
            return Optional.empty();
        }
        if (counts.getOrDefault(SendStatus.CANCELLED, 0L) > 0) {
            return Optional.of(CampaignStatus.CANCELLED);
        }
        if (counts.getOrDefault(SendStatus.FAILED, 0L) > 0) {
            return Optional.of(CampaignStatus.COMPLETED_WITH_ERRORS);
        }
        return Optional.of(CampaignStatus.COMPLETED);
    }
}
