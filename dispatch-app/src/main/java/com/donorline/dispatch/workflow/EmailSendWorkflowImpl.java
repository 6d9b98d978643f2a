package com.donorline.dispatch.workflow;

import com.donorline.dispatch.activity.SendActivities;
import com.donorline.dispatch.config.TaskQueues;
import com.donorline.dispatch.model.SendOutcome;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.UUID;

/**
 * Durable timer for a single send job.
 * <p>
 * This workflow is NOT a Spring bean; Temporal instantiates it. The only I/O is the
 * send activity, routed to {@code EMAIL_SEND_ACTIVITY_QUEUE}. Activity retries make
 * delivery of the send callback at-least-once; the pipeline's job claim turns a
 * repeated attempt into {@link SendOutcome#ALREADY_SENT} instead of a second email.
 */
public class EmailSendWorkflowImpl implements EmailSendWorkflow {

    private static final Logger log = Workflow.getLogger(EmailSendWorkflowImpl.class);

    private final SendActivities sendActivities = Workflow.newActivityStub(
            SendActivities.class,
            ActivityOptions.newBuilder()
                    .setTaskQueue(TaskQueues.EMAIL_SEND_ACTIVITY_QUEUE)
                    .setStartToCloseTimeout(Duration.ofMinutes(2))
                    .setRetryOptions(RetryOptions.newBuilder()
                            .setInitialInterval(Duration.ofSeconds(5))
                            .setBackoffCoefficient(2.0)
                            .setMaximumAttempts(3)
                            .build())
                    .build());

    @Override
    public SendOutcome dispatch(UUID jobId, long fireAtEpochMillis) {
        long delayMillis = fireAtEpochMillis - Workflow.currentTimeMillis();
        if (delayMillis > 0) {
            log.info("Job {} waiting {} ms until its send time", jobId, delayMillis);
            Workflow.sleep(Duration.ofMillis(delayMillis));
        }
        SendOutcome outcome = sendActivities.sendJob(jobId);
        log.info("Job {} finished with {}", jobId, outcome);
        return outcome;
    }
}
