package com.enterprise.jobscheduling.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a job
 */
public enum JobStatus {
    PENDING("pending"),        // Waiting for its next execution
    RUNNING("running"),        // An executor invocation is active
    COMPLETED("completed"),    // Last execution succeeded
    FAILED("failed");          // Last execution failed
    
    private final String value;
    
    JobStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() { return value; }
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
    
    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
