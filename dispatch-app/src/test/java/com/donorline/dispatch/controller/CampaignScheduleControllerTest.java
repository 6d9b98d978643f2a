package com.donorline.dispatch.controller;

import com.donorline.dispatch.exception.CampaignNotFoundException;
import com.donorline.dispatch.model.CampaignStatus;
import com.donorline.dispatch.model.JobStatus;
import com.donorline.dispatch.model.SendStatus;
import com.donorline.dispatch.scheduling.CampaignScheduleView;
import com.donorline.dispatch.scheduling.CampaignSchedulingService;
import com.donorline.dispatch.scheduling.CancelOutcome;
import com.donorline.dispatch.scheduling.InvalidScheduleConfigException;
import com.donorline.dispatch.scheduling.PauseOutcome;
import com.donorline.dispatch.scheduling.ScheduleConfig;
import com.donorline.dispatch.scheduling.ScheduleOutcome;
import com.donorline.dispatch.scheduling.SkippedMessage;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CampaignScheduleController.class)
@ActiveProfiles("service")
class CampaignScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CampaignSchedulingService schedulingService;

    @Test
    void schedule_withoutBody_shouldUseStoredRules() throws Exception {
        UUID campaignId = UUID.randomUUID();
        UUID skipped = UUID.randomUUID();
        when(schedulingService.scheduleEmailCampaign(eq(campaignId), isNull()))
                .thenReturn(new ScheduleOutcome(5, 2, 3, Instant.parse("2025-03-06T14:00:00Z"),
                        List.of(new SkippedMessage(skipped, "No credentialed sender available")), List.of()));

        mockMvc.perform(post("/campaigns/{id}/schedule", campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scheduled").value(5))
                .andExpect(jsonPath("$.scheduledForToday").value(2))
                .andExpect(jsonPath("$.scheduledForLater").value(3))
                .andExpect(jsonPath("$.skipped[0].messageId").value(skipped.toString()));
    }

    @Test
    void schedule_withBody_shouldPassOverride() throws Exception {
        UUID campaignId = UUID.randomUUID();
        when(schedulingService.scheduleEmailCampaign(eq(campaignId), any(ScheduleConfig.class)))
                .thenReturn(ScheduleOutcome.empty());

        mockMvc.perform(post("/campaigns/{id}/schedule", campaignId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "dailyLimit": 40,
                                    "minGapMinutes": 2,
                                    "maxGapMinutes": 4,
                                    "timezone": "America/Denver",
                                    "allowedDays": [1, 2, 3],
                                    "allowedStartTime": "10:00",
                                    "allowedEndTime": "15:00"
                                }
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<ScheduleConfig> captor = ArgumentCaptor.forClass(ScheduleConfig.class);
        verify(schedulingService).scheduleEmailCampaign(eq(campaignId), captor.capture());
        assertThat(captor.getValue().dailyLimit()).isEqualTo(40);
        assertThat(captor.getValue().allowedDays()).containsExactly(1, 2, 3);
    }

    @Test
    void schedule_withInvalidRules_shouldReturn400WithViolations() throws Exception {
        UUID campaignId = UUID.randomUUID();
        when(schedulingService.scheduleEmailCampaign(eq(campaignId), any(ScheduleConfig.class)))
                .thenThrow(new InvalidScheduleConfigException(List.of("dailyLimit must be between 1 and 500")));

        mockMvc.perform(post("/campaigns/{id}/schedule", campaignId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"dailyLimit": 900, "minGapMinutes": 1, "maxGapMinutes": 3,
                                 "timezone": "UTC", "allowedDays": [1], "allowedStartTime": "09:00",
                                 "allowedEndTime": "17:00"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.violations[0]").value("dailyLimit must be between 1 and 500"));
    }

    @Test
    void pause_unknownCampaign_shouldReturn404() throws Exception {
        UUID campaignId = UUID.randomUUID();
        when(schedulingService.pauseCampaign(campaignId)).thenThrow(new CampaignNotFoundException(campaignId));

        mockMvc.perform(post("/campaigns/{id}/pause", campaignId))
                .andExpect(status().isNotFound());
    }

    @Test
    void pause_shouldReturnCancelledJobCount() throws Exception {
        UUID campaignId = UUID.randomUUID();
        when(schedulingService.pauseCampaign(campaignId)).thenReturn(new PauseOutcome(4));

        mockMvc.perform(post("/campaigns/{id}/pause", campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelledJobs").value(4));
    }

    @Test
    void resumeCancelAndRetry_shouldDelegate() throws Exception {
        UUID campaignId = UUID.randomUUID();
        when(schedulingService.resumeCampaign(campaignId)).thenReturn(ScheduleOutcome.empty());
        when(schedulingService.cancelCampaign(campaignId)).thenReturn(new CancelOutcome(2, 3));
        when(schedulingService.retryFailedMessages(campaignId)).thenReturn(ScheduleOutcome.empty());

        mockMvc.perform(post("/campaigns/{id}/resume", campaignId)).andExpect(status().isOk());
        mockMvc.perform(post("/campaigns/{id}/cancel", campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelledEmails").value(3));
        mockMvc.perform(post("/campaigns/{id}/retry-failed", campaignId)).andExpect(status().isOk());

        verify(schedulingService).resumeCampaign(campaignId);
        verify(schedulingService).cancelCampaign(campaignId);
        verify(schedulingService).retryFailedMessages(campaignId);
    }

    @Test
    void getSchedule_shouldReturnView() throws Exception {
        UUID campaignId = UUID.randomUUID();
        when(schedulingService.getCampaignSchedule(campaignId)).thenReturn(new CampaignScheduleView(
                campaignId, "org-1", "Spring appeal", CampaignStatus.RUNNING,
                Map.of(SendStatus.SCHEDULED, 2L), Map.of(JobStatus.SCHEDULED, 2L), List.of(),
                Instant.parse("2025-03-04T19:00:00Z"), null, Instant.parse("2025-03-04T19:01:00Z")));

        mockMvc.perform(get("/campaigns/{id}/schedule", campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.messageCounts.SCHEDULED").value(2));
    }
}
