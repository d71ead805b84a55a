package com.enterprise.jobscheduling.exception;

/**
 * Exception thrown when schedule fields cannot be resolved into a fire plan
 */
public class InvalidScheduleException extends ValidationException {
    
    public InvalidScheduleException(String field, String message) {
        super(field, message);
    }
}
