package com.donorline.dispatch.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one scheduled send. A job is created {@link #SCHEDULED}, claimed as
 * {@link #RUNNING} when its trigger fires, and ends in one of the terminal states.
 */
public enum JobStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
