package com.donorline.dispatch.activity;

import com.donorline.dispatch.model.SendOutcome;
import io.temporal.activity.ActivityInterface;

import java.util.UUID;

@ActivityInterface
public interface SendActivities {

    /**
     * Runs the send pipeline for one job. Per-message failures are returned as
     * {@link SendOutcome#FAILED}, not thrown; an exception means the pipeline could not
     * record its outcome and the attempt should be retried.
     */
    SendOutcome sendJob(UUID jobId);
}
