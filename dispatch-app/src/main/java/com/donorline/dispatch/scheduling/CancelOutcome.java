package com.donorline.dispatch.scheduling;

public record CancelOutcome(int cancelledJobs, int cancelledEmails) {
}
