package com.donorline.dispatch.send;

import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.repository.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically repairs campaigns whose completion check never ran, e.g. after a
 * worker crashed between recording a send and checking the campaign.
 */
@Component
@Profile("service")
@RequiredArgsConstructor
@Slf4j
public class StuckCampaignSweeper {

    private final JobStore jobStore;
    private final CampaignCompletionChecker completionChecker;

    @Scheduled(fixedDelayString = "${dispatch.repair.interval:PT15M}",
            initialDelayString = "${dispatch.repair.initial-delay:PT1M}")
    public void sweep() {
        int repaired = 0;
        for (String organizationId : jobStore.findOrganizationsWithCampaigns(CampaignStatus.REPAIRABLE)) {
            try {
                repaired += completionChecker.fixStuckCampaigns(organizationId);
            } catch (Exception e) {
                log.error("Error repairing campaigns of organization {}", organizationId, e);
            }
        }
        if (repaired > 0) {
            log.info("Stuck campaign sweep repaired {} campaigns", repaired);
        }
    }
}
