package com.donorline.dispatch.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Delivery status of a campaign message.
 */
public enum SendStatus {
    PENDING,
    SCHEDULED,
    SENDING,
    SENT,
    PAUSED,
    CANCELLED,
    FAILED;

    /**
     * Statuses that still expect a send to happen. {@link #PAUSED} counts as open:
     * a paused message can be resumed.
     */
    public static final Set<SendStatus> OPEN = EnumSet.of(PENDING, SCHEDULED, SENDING, PAUSED);

    /** Statuses that {@code cancelCampaign} moves to {@link #CANCELLED}. */
    public static final Set<SendStatus> CANCELLABLE = EnumSet.of(PENDING, SCHEDULED, PAUSED);
}
