package com.donorline.dispatch.model.dto;

import com.donorline.dispatch.model.SendOutcome;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per terminal send pipeline outcome.
 */
public record EmailSendEvent(
        UUID jobId,
        UUID messageId,
        UUID campaignId,
        String organizationId,
        SendOutcome outcome,
        String error,
        Instant occurredAt
) {
}
