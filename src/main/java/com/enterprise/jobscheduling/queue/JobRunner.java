package com.enterprise.jobscheduling.queue;

import java.util.UUID;

/**
 * Execution entrypoint invoked by queue workers
 */
@FunctionalInterface
public interface JobRunner {
    
    void run(UUID jobId);
}
