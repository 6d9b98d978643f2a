package com.donorline.dispatch.scheduling;

public record PauseOutcome(int cancelledJobs) {
}
