package com.enterprise.jobscheduling.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a job is scheduled: run now, run once later, or recur.
 */
public enum ScheduleType {
    IMMEDIATE("immediate"),
    SCHEDULED("scheduled"),
    INTERVAL("interval");
    
    private final String value;
    
    ScheduleType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() { return value; }
    
    /**
     * Whether jobs of this schedule type can be rescheduled after creation
     */
    public boolean isReschedulable() {
        return this != IMMEDIATE;
    }
    
    @JsonCreator
    public static ScheduleType fromValue(String value) {
        for (ScheduleType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown schedule type: " + value);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
