package com.enterprise.jobscheduling.exception;

import java.util.UUID;

/**
 * Exception thrown when a requested job is not found
 */
public class JobNotFoundException extends JobSchedulingException {
    
    private final UUID jobId;
    
    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
    
    protected JobNotFoundException(UUID jobId, String message) {
        super(message);
        this.jobId = jobId;
    }
    
    public UUID getJobId() {
        return jobId;
    }
}
