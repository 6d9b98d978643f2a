package com.donorline.dispatch.model;

import java.util.EnumSet;
import java.util.Set;

public enum CampaignStatus {
    DRAFT,
    GENERATING,
    READY_TO_SEND,
    RUNNING,
    PAUSED,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    CANCELLED;

    /** Statuses the stuck-campaign repair re-evaluates. */
    public static final Set<CampaignStatus> REPAIRABLE = EnumSet.of(READY_TO_SEND, RUNNING, PAUSED);

    public boolean isFinished() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS || this == CANCELLED;
    }
}
