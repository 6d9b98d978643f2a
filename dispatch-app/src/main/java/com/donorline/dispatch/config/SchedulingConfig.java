package com.donorline.dispatch.config;

import com.donorline.dispatch.scheduling.BatchScheduler;
import com.donorline.dispatch.scheduling.RandomGapGenerator;
import com.donorline.dispatch.scheduling.TimeWindowEvaluator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Wires the pure scheduling algorithm from dispatch-common into the context and
 * enables the periodic stuck-campaign sweep.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Bean
    public TimeWindowEvaluator timeWindowEvaluator() {
        return new TimeWindowEvaluator();
    }

    @Bean
    public BatchScheduler batchScheduler(TimeWindowEvaluator timeWindowEvaluator) {
        return new BatchScheduler(timeWindowEvaluator, new RandomGapGenerator());
    }
}
