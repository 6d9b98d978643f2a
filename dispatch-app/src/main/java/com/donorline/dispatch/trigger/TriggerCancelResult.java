package com.donorline.dispatch.trigger;

public enum TriggerCancelResult {
    CANCELLED,
    ALREADY_FIRED
}
