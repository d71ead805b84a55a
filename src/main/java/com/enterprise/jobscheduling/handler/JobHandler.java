package com.enterprise.jobscheduling.handler;

import com.enterprise.jobscheduling.core.Job;

import java.util.Map;

/**
 * Type-specific execution logic for a job.
 * Implementations must be thread-safe; the same handler runs jobs on several workers at once.
 */
@FunctionalInterface
public interface JobHandler {
    
    /**
     * Run the job
     * @return result payload stored on the completed job
     * @throws Exception any failure; the executor decides whether to retry
     */
    Map<String, Object> handle(Job job) throws Exception;
}
