package com.donorline.dispatch.controller;

import com.donorline.dispatch.scheduling.CampaignScheduleView;
import com.donorline.dispatch.scheduling.CampaignSchedulingService;
import com.donorline.dispatch.scheduling.CancelOutcome;
import com.donorline.dispatch.scheduling.PauseOutcome;
import com.donorline.dispatch.scheduling.ScheduleConfig;
import com.donorline.dispatch.scheduling.ScheduleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Profile("service")
@RequestMapping("/campaigns/{campaignId}")
@RequiredArgsConstructor
@Slf4j
public class CampaignScheduleController {

    private final CampaignSchedulingService schedulingService;

    /**
     * Schedules the campaign's pending messages. A body, when present, becomes the
     * campaign's own sending rules.
     */
    @PostMapping("/schedule")
    public ResponseEntity<ScheduleOutcome> schedule(@PathVariable UUID campaignId,
                                                    @RequestBody(required = false) ScheduleConfig override) {
        log.info("Schedule requested for campaign {} (override={})", campaignId, override != null);
        return ResponseEntity.ok(schedulingService.scheduleEmailCampaign(campaignId, override));
    }

    @PostMapping("/pause")
    public ResponseEntity<PauseOutcome> pause(@PathVariable UUID campaignId) {
        log.info("Pause requested for campaign {}", campaignId);
        return ResponseEntity.ok(schedulingService.pauseCampaign(campaignId));
    }

    @PostMapping("/resume")
    public ResponseEntity<ScheduleOutcome> resume(@PathVariable UUID campaignId) {
        log.info("Resume requested for campaign {}", campaignId);
        return ResponseEntity.ok(schedulingService.resumeCampaign(campaignId));
    }

    @PostMapping("/cancel")
    public ResponseEntity<CancelOutcome> cancel(@PathVariable UUID campaignId) {
        log.info("Cancel requested for campaign {}", campaignId);
        return ResponseEntity.ok(schedulingService.cancelCampaign(campaignId));
    }

    @PostMapping("/retry-failed")
    public ResponseEntity<ScheduleOutcome> retryFailed(@PathVariable UUID campaignId) {
        log.info("Retry of failed messages requested for campaign {}", campaignId);
        return ResponseEntity.ok(schedulingService.retryFailedMessages(campaignId));
    }

    @GetMapping("/schedule")
    public ResponseEntity<CampaignScheduleView> getSchedule(@PathVariable UUID campaignId) {
        return ResponseEntity.ok(schedulingService.getCampaignSchedule(campaignId));
    }
}
