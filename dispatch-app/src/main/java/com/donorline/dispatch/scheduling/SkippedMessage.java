package com.donorline.dispatch.scheduling;

import java.util.UUID;

public record SkippedMessage(UUID messageId, String reason) {
}
