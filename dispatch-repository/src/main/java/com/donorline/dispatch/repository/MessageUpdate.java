package com.donorline.dispatch.repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Fields written together with a message status change. {@code null} leaves a field
 * as is; {@code clearSchedule} detaches the message from its job and send time.
 */
public record MessageUpdate(UUID sendJobId, Instant scheduledSendTime, String lastError, boolean clearSchedule) {

    public static MessageUpdate none() {
        return new MessageUpdate(null, null, null, false);
    }

    public static MessageUpdate scheduled(UUID sendJobId, Instant scheduledSendTime) {
        return new MessageUpdate(sendJobId, scheduledSendTime, null, false);
    }

    public static MessageUpdate failed(String lastError) {
        return new MessageUpdate(null, null, lastError, false);
    }

    public static MessageUpdate unscheduled() {
        return new MessageUpdate(null, null, null, true);
    }
}
