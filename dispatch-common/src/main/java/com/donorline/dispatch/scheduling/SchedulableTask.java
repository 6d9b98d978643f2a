package com.donorline.dispatch.scheduling;

/**
 * One unit of work waiting for a send time. A {@code null} priority counts as 0.
 */
public record SchedulableTask<T>(String id, T payload, Integer priority) {

    public SchedulableTask(String id, T payload) {
        this(id, payload, null);
    }

    public int effectivePriority() {
        return priority != null ? priority : 0;
    }
}
