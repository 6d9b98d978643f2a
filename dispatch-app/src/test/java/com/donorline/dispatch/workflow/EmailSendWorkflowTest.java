package com.donorline.dispatch.workflow;

import com.donorline.dispatch.activity.SendActivities;
import com.donorline.dispatch.config.TaskQueues;
import com.donorline.dispatch.model.SendOutcome;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowOptions;
import io.temporal.testing.TestWorkflowEnvironment;
import io.temporal.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailSendWorkflowTest {

    private TestWorkflowEnvironment testEnv;
    private WorkflowClient workflowClient;
    private SendActivities sendActivities;

    @BeforeEach
    void setUp() {
        testEnv = TestWorkflowEnvironment.newInstance();
        Worker workflowWorker = testEnv.newWorker(TaskQueues.EMAIL_DISPATCH_QUEUE);
        workflowWorker.registerWorkflowImplementationTypes(EmailSendWorkflowImpl.class);

        sendActivities = mock(SendActivities.class);
        Worker sendWorker = testEnv.newWorker(TaskQueues.EMAIL_SEND_ACTIVITY_QUEUE);
        sendWorker.registerActivitiesImplementations(sendActivities);

        workflowClient = testEnv.getWorkflowClient();
        testEnv.start();
    }

    @AfterEach
    void tearDown() {
        testEnv.close();
    }

    @Test
    void dispatch_shouldWaitUntilFireTimeThenSend() {
        UUID jobId = UUID.randomUUID();
        when(sendActivities.sendJob(jobId)).thenReturn(SendOutcome.SENT);
        long fireAt = testEnv.currentTimeMillis() + Duration.ofHours(3).toMillis();

        SendOutcome outcome = newWorkflow(jobId).dispatch(jobId, fireAt);

        assertThat(outcome).isEqualTo(SendOutcome.SENT);
        assertThat(testEnv.currentTimeMillis()).isGreaterThanOrEqualTo(fireAt);
        verify(sendActivities, times(1)).sendJob(jobId);
    }

    @Test
    void dispatch_withPastFireTime_shouldSendImmediately() {
        UUID jobId = UUID.randomUUID();
        when(sendActivities.sendJob(jobId)).thenReturn(SendOutcome.ALREADY_SENT);

        SendOutcome outcome = newWorkflow(jobId).dispatch(jobId, testEnv.currentTimeMillis() - 60_000);

        assertThat(outcome).isEqualTo(SendOutcome.ALREADY_SENT);
    }

    @Test
    void dispatch_shouldRetryActivityOnTransientError() {
        UUID jobId = UUID.randomUUID();
        when(sendActivities.sendJob(jobId))
                .thenThrow(new IllegalStateException("database unavailable"))
                .thenReturn(SendOutcome.SENT);

        SendOutcome outcome = newWorkflow(jobId).dispatch(jobId, testEnv.currentTimeMillis());

        assertThat(outcome).isEqualTo(SendOutcome.SENT);
        verify(sendActivities, times(2)).sendJob(jobId);
    }

    private EmailSendWorkflow newWorkflow(UUID jobId) {
        return workflowClient.newWorkflowStub(
                EmailSendWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setWorkflowId("test-send-" + jobId)
                        .setTaskQueue(TaskQueues.EMAIL_DISPATCH_QUEUE)
                        .build());
    }
}
