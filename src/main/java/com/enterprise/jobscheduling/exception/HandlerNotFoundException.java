package com.enterprise.jobscheduling.exception;

import com.enterprise.jobscheduling.core.JobType;

/**
 * Exception thrown when no handler is registered for a job type
 */
public class HandlerNotFoundException extends JobSchedulingException {
    
    private final JobType jobType;
    
    public HandlerNotFoundException(JobType jobType) {
        super("No handler found for job type: " + jobType);
        this.jobType = jobType;
    }
    
    public JobType getJobType() {
        return jobType;
    }
}
