package com.donorline.dispatch.trigger;

import java.util.UUID;

public class TriggerRegistrationException extends RuntimeException {

    public TriggerRegistrationException(UUID jobId, Throwable cause) {
        super("Could not register trigger for job " + jobId + ": " + cause.getMessage(), cause);
    }
}
