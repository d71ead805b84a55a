package com.enterprise.jobscheduling.exception;

import com.enterprise.jobscheduling.core.JobStatus;

import java.util.UUID;

/**
 * Exception thrown when an operation is not allowed in the job's current state
 */
public class InvalidStateException extends JobSchedulingException {
    
    private final UUID jobId;
    private final JobStatus status;
    
    public InvalidStateException(UUID jobId, JobStatus status, String message) {
        super(message);
        this.jobId = jobId;
        this.status = status;
    }
    
    public UUID getJobId() {
        return jobId;
    }
    
    public JobStatus getStatus() {
        return status;
    }
}
