package com.enterprise.jobscheduling.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Recurrence period of an interval job
 */
public enum Frequency {
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    YEARLY("yearly");
    
    private final String value;
    
    Frequency(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() { return value; }
    
    @JsonCreator
    public static Frequency fromValue(String value) {
        for (Frequency frequency : values()) {
            if (frequency.value.equalsIgnoreCase(value)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown frequency: " + value);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
