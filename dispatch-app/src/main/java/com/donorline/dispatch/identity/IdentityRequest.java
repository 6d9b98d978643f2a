package com.donorline.dispatch.identity;

import java.util.UUID;

/**
 * What the resolver knows about a message when picking its sender.
 */
public record IdentityRequest(UUID donorId, String organizationId, UUID campaignOwnerUserId) {
}
