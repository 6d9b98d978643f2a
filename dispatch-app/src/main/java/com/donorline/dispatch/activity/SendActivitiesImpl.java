package com.donorline.dispatch.activity;

import com.donorline.dispatch.model.SendOutcome;
import com.donorline.dispatch.send.SendPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Activity implementation backed by the Spring-managed {@link SendPipeline}.
 */
@Component
@Profile({"wf-worker", "send-wf-worker"})
@RequiredArgsConstructor
@Slf4j
public class SendActivitiesImpl implements SendActivities {

    private final SendPipeline sendPipeline;

    @Override
    public SendOutcome sendJob(UUID jobId) {
        log.info("Send fired for job {}", jobId);
        return sendPipeline.sendJob(jobId);
    }
}
