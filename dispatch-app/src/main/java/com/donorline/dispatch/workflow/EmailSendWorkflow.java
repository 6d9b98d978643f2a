package com.donorline.dispatch.workflow;

import com.donorline.dispatch.model.SendOutcome;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

import java.util.UUID;

@WorkflowInterface
public interface EmailSendWorkflow {

    /**
     * Waits until {@code fireAtEpochMillis}, then runs the send pipeline for the job.
     * Cancelling the workflow while it waits is how a not-yet-fired send is withdrawn.
     */
    @WorkflowMethod
    SendOutcome dispatch(UUID jobId, long fireAtEpochMillis);
}
