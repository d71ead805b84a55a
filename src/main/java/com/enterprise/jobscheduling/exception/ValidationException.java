package com.enterprise.jobscheduling.exception;

/**
 * Exception thrown when a job request carries missing or malformed fields.
 * The job is never persisted.
 */
public class ValidationException extends JobSchedulingException {
    
    private final String field;
    private final String reason;
    
    public ValidationException(String field, String reason) {
        super(field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }
    
    public String getField() {
        return field;
    }
    
    /** Message without the field name */
    public String getReason() {
        return reason;
    }
}
