package com.donorline.dispatch.trigger;

import java.time.Instant;
import java.util.UUID;

/**
 * Deferred execution of send jobs. Delivery of the callback is at-least-once; the
 * send pipeline's guarded transitions make repeats harmless.
 */
public interface JobTriggerGateway {

    /**
     * Arranges for the job to be sent at {@code at}.
     *
     * @return a handle for {@link #cancel}
     * @throws TriggerRegistrationException if the trigger could not be registered
     */
    String scheduleCallback(UUID jobId, Instant at);

    /**
     * Cancels a trigger. Cancelling one that already fired is a no-op.
     */
    TriggerCancelResult cancel(String triggerHandle);
}
