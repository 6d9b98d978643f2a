package com.donorline.dispatch.controller;

import com.donorline.dispatch.scheduling.CampaignSchedulingService;
import com.donorline.dispatch.scheduling.ScheduleConfig;
import com.donorline.dispatch.scheduling.ScheduleSettingsService;
import com.donorline.dispatch.send.CampaignCompletionChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Organization-wide sending rules and campaign repair.
 */
@RestController
@Profile("service")
@RequestMapping("/organizations/{organizationId}")
@RequiredArgsConstructor
@Slf4j
public class OrganizationController {

    private final ScheduleSettingsService settingsService;
    private final CampaignSchedulingService schedulingService;
    private final CampaignCompletionChecker completionChecker;

    @GetMapping("/schedule-config")
    public ResponseEntity<ScheduleConfig> getScheduleConfig(@PathVariable String organizationId) {
        return ResponseEntity.ok(settingsService.getOrCreate(organizationId));
    }

    /**
     * Stores new rules. With {@code rescheduleExisting=true} the unsent messages of
     * running campaigns that follow the organization rules are planned again.
     */
    @PutMapping("/schedule-config")
    public ResponseEntity<ScheduleConfigUpdate> updateScheduleConfig(
            @PathVariable String organizationId,
            @RequestBody ScheduleConfig config,
            @RequestParam(defaultValue = "false") boolean rescheduleExisting) {
        ScheduleConfig saved = settingsService.update(organizationId, config);
        int rescheduled = rescheduleExisting ? schedulingService.rescheduleOrganization(organizationId) : 0;
        log.info("Schedule config updated for organization {}; {} messages rescheduled", organizationId, rescheduled);
        return ResponseEntity.ok(new ScheduleConfigUpdate(saved, rescheduled));
    }

    @PostMapping("/campaigns/repair")
    public ResponseEntity<RepairResult> repairCampaigns(@PathVariable String organizationId) {
        int fixed = completionChecker.fixStuckCampaigns(organizationId);
        log.info("Repair for organization {} finished {} campaigns", organizationId, fixed);
        return ResponseEntity.ok(new RepairResult(fixed));
    }

    public record ScheduleConfigUpdate(ScheduleConfig config, int rescheduled) {
    }

    public record RepairResult(int fixed) {
    }
}
