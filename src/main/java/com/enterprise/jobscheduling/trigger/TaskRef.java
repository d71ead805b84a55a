package com.enterprise.jobscheduling.trigger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a trigger does when it fires
 */
public enum TaskRef {
    EXECUTE_JOB("execute_job"),          // args: job id
    ENABLE_TRIGGER("enable_trigger");    // args: name of the trigger to enable
    
    private final String value;
    
    TaskRef(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() { return value; }
    
    @JsonCreator
    public static TaskRef fromValue(String value) {
        for (TaskRef ref : values()) {
            if (ref.value.equals(value)) {
                return ref;
            }
        }
        throw new IllegalArgumentException("Unknown task reference: " + value);
    }
}
