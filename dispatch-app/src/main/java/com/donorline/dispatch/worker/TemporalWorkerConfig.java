package com.donorline.dispatch.worker;

import com.donorline.dispatch.activity.SendActivitiesImpl;
import com.donorline.dispatch.config.TaskQueues;
import com.donorline.dispatch.workflow.EmailSendWorkflowImpl;
import io.temporal.client.WorkflowClient;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Temporal worker factory and worker registration. Each @Profile maps to a
 * deployment mode:
 * <ul>
 *   <li>{@code wf-worker}: combined mode (local dev). Send workflow timers and
 *       the send activity in one JVM, each on its own task queue.</li>
 *   <li>{@code wf-worker-orchestrator}: timers only on EMAIL_DISPATCH_QUEUE.</li>
 *   <li>{@code send-wf-worker}: the send activity only on EMAIL_SEND_ACTIVITY_QUEUE.</li>
 * </ul>
 */
@Configuration
public class TemporalWorkerConfig {

    @Bean(initMethod = "start", destroyMethod = "shutdownNow")
    @Profile("wf-worker")
    public WorkerFactory combinedWorkerFactory(
            WorkflowClient workflowClient,
            SendActivitiesImpl sendActivities,
            @Value("${dispatch.worker.max-concurrent-sends:10}") int maxConcurrentSends) {

        WorkerFactory factory = WorkerFactory.newInstance(workflowClient);

        Worker workflowWorker = factory.newWorker(TaskQueues.EMAIL_DISPATCH_QUEUE);
        workflowWorker.registerWorkflowImplementationTypes(EmailSendWorkflowImpl.class);

        Worker sendWorker = factory.newWorker(TaskQueues.EMAIL_SEND_ACTIVITY_QUEUE, sendWorkerOptions(maxConcurrentSends));
        sendWorker.registerActivitiesImplementations(sendActivities);

        return factory;
    }

    /**
     * Timers only, no activities and no I/O.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdownNow")
    @Profile("wf-worker-orchestrator")
    public WorkerFactory workflowOnlyFactory(WorkflowClient workflowClient) {
        WorkerFactory factory = WorkerFactory.newInstance(workflowClient);
        Worker worker = factory.newWorker(TaskQueues.EMAIL_DISPATCH_QUEUE);
        worker.registerWorkflowImplementationTypes(EmailSendWorkflowImpl.class);
        return factory;
    }

    @Bean(initMethod = "start", destroyMethod = "shutdownNow")
    @Profile("send-wf-worker")
    public WorkerFactory sendWorkerFactory(
            WorkflowClient workflowClient,
            SendActivitiesImpl sendActivities,
            @Value("${dispatch.worker.max-concurrent-sends:10}") int maxConcurrentSends) {
        WorkerFactory factory = WorkerFactory.newInstance(workflowClient);
        Worker worker = factory.newWorker(TaskQueues.EMAIL_SEND_ACTIVITY_QUEUE, sendWorkerOptions(maxConcurrentSends));
        worker.registerActivitiesImplementations(sendActivities);
        return factory;
    }

    private static WorkerOptions sendWorkerOptions(int maxConcurrentSends) {
        return WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(maxConcurrentSends)
                .build();
    }
}
