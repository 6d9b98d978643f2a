package com.donorline.dispatch.config;

/**
 * Temporal task queue name constants shared across all modules.
 * <p>
 * {@code EMAIL_DISPATCH_QUEUE}: per-job send workflows (durable timer, no I/O).
 * {@code EMAIL_SEND_ACTIVITY_QUEUE}: the send activity that runs the send pipeline.
 * <p>
 * Workflows run on {@code EMAIL_DISPATCH_QUEUE}. The activity stub routes the send
 * step to {@code EMAIL_SEND_ACTIVITY_QUEUE} via {@code ActivityOptions.setTaskQueue()}
 * so provider calls scale separately from timer bookkeeping.
 */
public final class TaskQueues {

    public static final String EMAIL_DISPATCH_QUEUE = "EMAIL_DISPATCH_QUEUE";
    public static final String EMAIL_SEND_ACTIVITY_QUEUE = "EMAIL_SEND_ACTIVITY_QUEUE";

    private TaskQueues() {
        // constants only
    }
}
