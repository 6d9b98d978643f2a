package com.donorline.dispatch.trigger;

import com.donorline.dispatch.workflow.EmailSendWorkflow;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowException;
import io.temporal.client.WorkflowNotFoundException;
import io.temporal.client.WorkflowOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Trigger gateway on Temporal: one {@link EmailSendWorkflow} per job, sleeping on a
 * durable timer until the send time. The workflow id doubles as the trigger handle.
 */
@Component
@Profile("service")
@Slf4j
public class TemporalTriggerGateway implements JobTriggerGateway {

    static final String WORKFLOW_ID_PREFIX = "email-send-";

    private final WorkflowClient workflowClient;
    private final String taskQueue;

    public TemporalTriggerGateway(
            WorkflowClient workflowClient,
            @Value("${temporal.worker.task-queue}") String taskQueue) {
        this.workflowClient = workflowClient;
        this.taskQueue = taskQueue;
    }

    @Override
    public String scheduleCallback(UUID jobId, Instant at) {
        String workflowId = WORKFLOW_ID_PREFIX + jobId;
        WorkflowOptions options = WorkflowOptions.newBuilder()
                .setWorkflowId(workflowId)
                .setTaskQueue(taskQueue)
                .build();
        try {
            EmailSendWorkflow workflow = workflowClient.newWorkflowStub(EmailSendWorkflow.class, options);
            WorkflowClient.start(workflow::dispatch, jobId, at.toEpochMilli());
        } catch (WorkflowException e) {
            throw new TriggerRegistrationException(jobId, e);
        }
        log.debug("Started {} for job {} firing at {}", workflowId, jobId, at);
        return workflowId;
    }

    @Override
    public TriggerCancelResult cancel(String triggerHandle) {
        try {
            workflowClient.newUntypedWorkflowStub(triggerHandle, Optional.empty(), Optional.empty()).cancel();
            log.debug("Cancelled trigger {}", triggerHandle);
            return TriggerCancelResult.CANCELLED;
        } catch (WorkflowNotFoundException e) {
            log.debug("Trigger {} already fired", triggerHandle);
            return TriggerCancelResult.ALREADY_FIRED;
        }
    }
}
