package com.donorline.dispatch.send;

import com.donorline.dispatch.messaging.DispatchEventPublisher;
import com.donorline.dispatch.model.Campaign;
import com.donorline.dispatch.model.CampaignMessage;
import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.model.SendStatus;
import com.donorline.dispatch.model.dto.CampaignStatusEvent;
import com.donorline.dispatch.support.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CampaignCompletionCheckerTest {

    private static final Instant NOW = Instant.parse("2025-03-04T19:00:00Z");

    @Mock
    private DispatchEventPublisher eventPublisher;

    private InMemoryJobStore jobStore;
    private CampaignCompletionChecker checker;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        checker = new CampaignCompletionChecker(jobStore, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void checkAndUpdate_withFailures_shouldCompleteWithErrors() {
        Campaign campaign = campaign("org-1", CampaignStatus.RUNNING);
        addMessage(campaign, SendStatus.SENT);
        addMessage(campaign, SendStatus.SENT);
        addMessage(campaign, SendStatus.FAILED);

        Optional<CampaignStatus> result = checker.checkAndUpdate(campaign.getId());

        assertThat(result).contains(CampaignStatus.COMPLETED_WITH_ERRORS);
        assertThat(jobStore.campaign(campaign.getId()).getStatus()).isEqualTo(CampaignStatus.COMPLETED_WITH_ERRORS);
        ArgumentCaptor<CampaignStatusEvent> event = ArgumentCaptor.forClass(CampaignStatusEvent.class);
        verify(eventPublisher).publishCampaignStatus(event.capture());
        assertThat(event.getValue().status()).isEqualTo(CampaignStatus.COMPLETED_WITH_ERRORS);
        assertThat(event.getValue().occurredAt()).isEqualTo(NOW);
    }

    @Test
    void checkAndUpdate_withOpenMessages_shouldLeaveCampaignRunning() {
        Campaign campaign = campaign("org-1", CampaignStatus.RUNNING);
        addMessage(campaign, SendStatus.SENT);
        addMessage(campaign, SendStatus.SCHEDULED);

        assertThat(checker.checkAndUpdate(campaign.getId())).isEmpty();
        assertThat(jobStore.campaign(campaign.getId()).getStatus()).isEqualTo(CampaignStatus.RUNNING);
        verify(eventPublisher, never()).publishCampaignStatus(any());
    }

    @Test
    void checkAndUpdate_withPausedMessages_shouldNotFinish() {
        Campaign campaign = campaign("org-1", CampaignStatus.PAUSED);
        addMessage(campaign, SendStatus.SENT);
        addMessage(campaign, SendStatus.PAUSED);

        assertThat(checker.checkAndUpdate(campaign.getId())).isEmpty();
    }

    @Test
    void checkAndUpdate_withoutMessages_shouldNotFinish() {
        Campaign campaign = campaign("org-1", CampaignStatus.READY_TO_SEND);

        assertThat(checker.checkAndUpdate(campaign.getId())).isEmpty();
    }

    @Test
    void evaluate_shouldRankCancelledOverFailed() {
        assertThat(CampaignCompletionChecker.evaluate(Map.of(SendStatus.SENT, 3L)))
                .contains(CampaignStatus.COMPLETED);
        assertThat(CampaignCompletionChecker.evaluate(Map.of(SendStatus.FAILED, 1L, SendStatus.CANCELLED, 1L)))
                .contains(CampaignStatus.CANCELLED);
        assertThat(CampaignCompletionChecker.evaluate(Map.of(SendStatus.CANCELLED, 2L)))
                .contains(CampaignStatus.CANCELLED);
    }

    @Test
    void fixStuckCampaigns_shouldFinishOnlyCampaignsWithNothingLeft() {
        Campaign stuck = campaign("org-1", CampaignStatus.RUNNING);
        addMessage(stuck, SendStatus.SENT);
        Campaign active = campaign("org-1", CampaignStatus.RUNNING);
        addMessage(active, SendStatus.SCHEDULED);
        Campaign otherOrg = campaign("org-2", CampaignStatus.RUNNING);
        addMessage(otherOrg, SendStatus.SENT);

        int fixed = checker.fixStuckCampaigns("org-1");

        assertThat(fixed).isEqualTo(1);
        assertThat(jobStore.campaign(stuck.getId()).getStatus()).isEqualTo(CampaignStatus.COMPLETED);
        assertThat(jobStore.campaign(active.getId()).getStatus()).isEqualTo(CampaignStatus.RUNNING);
        assertThat(jobStore.campaign(otherOrg.getId()).getStatus()).isEqualTo(CampaignStatus.RUNNING);
    }

    private Campaign campaign(String organizationId, CampaignStatus status) {
        return jobStore.addCampaign(Campaign.builder()
                .id(UUID.randomUUID())
                .organizationId(organizationId)
                .name("Campaign")
                .status(status)
                .build());
    }

    private void addMessage(Campaign campaign, SendStatus status) {
        jobStore.addMessage(CampaignMessage.builder()
                .id(UUID.randomUUID())
                .campaignId(campaign.getId())
                .organizationId(campaign.getOrganizationId())
                .donorId(UUID.randomUUID())
                .recipientEmail("donor@example.com")
                .subject("Hello")
                .body("Body")
                .sendStatus(status)
                .sent(status == SendStatus.SENT)
                .build());
    }
}
