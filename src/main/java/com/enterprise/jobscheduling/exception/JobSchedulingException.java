package com.enterprise.jobscheduling.exception;

/**
 * Base exception for job scheduling related errors
 */
public class JobSchedulingException extends Exception {
    
    public JobSchedulingException(String message) {
        super(message);
    }
    
    public JobSchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
