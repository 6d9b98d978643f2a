package com.donorline.dispatch.scheduling;

import java.util.List;

/**
 * Thrown when a {@link ScheduleConfig} is rejected. Nothing has been scheduled or
 * persisted when this is raised.
 */
public class InvalidScheduleConfigException extends RuntimeException {

    private final List<String> violations;

    public InvalidScheduleConfigException(List<String> violations) {
        super("Invalid schedule configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
