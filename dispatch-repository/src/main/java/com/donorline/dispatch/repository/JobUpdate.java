package com.donorline.dispatch.repository;

import java.time.Instant;

/**
 * Fields written together with a job status change. {@code null} leaves a field as is.
 */
public record JobUpdate(boolean incrementAttempt, Instant actualSendTime, String lastError) {

    public static JobUpdate none() {
        return new JobUpdate(false, null, null);
    }

    public static JobUpdate claim() {
        return new JobUpdate(true, null, null);
    }

    public static JobUpdate completed(Instant actualSendTime) {
        return new JobUpdate(false, actualSendTime, null);
    }

    public static JobUpdate failed(String lastError) {
        return new JobUpdate(false, null, lastError);
    }
}
