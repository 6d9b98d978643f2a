package com.donorline.dispatch.model.dto;

import com.donorline.dispatch.model.CampaignStatus;

import java.time.Instant;
import java.util.UUID;

public record CampaignStatusEvent(
        UUID campaignId,
        String organizationId,
        CampaignStatus status,
        Instant occurredAt
) {
}
