package com.enterprise.jobscheduling.handler;

import com.enterprise.jobscheduling.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Placeholder action for job types without dedicated logic.
 * Waits a fixed simulated duration and succeeds.
 */
public class GenericJobHandler implements JobHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(GenericJobHandler.class);
    
    private final Duration simulatedDuration;
    
    public GenericJobHandler(Duration simulatedDuration) {
        this.simulatedDuration = simulatedDuration;
    }
    
    @Override
    public Map<String, Object> handle(Job job) {
        logger.debug("Simulating {} for job {} ({}ms)", job.getJobType(), job.getId(), simulatedDuration.toMillis());
        
        if (!simulatedDuration.isZero()) {
            try {
                Thread.sleep(simulatedDuration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Job " + job.getId() + " interrupted", e);
            }
        }
        
        return Map.of("message", job.getJobType().getValue() + " completed successfully.");
    }
}
