package com.enterprise.jobscheduling.service;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.core.ScheduleType;

import java.time.Instant;
import java.util.Map;

/**
 * Partial update of a job. Null fields are left unchanged.
 * Only the schedule fields may be changed; the others exist so that attempts to change them can be rejected.
 */
public final class JobUpdate {
    
    private final ScheduleType scheduleType;
    private final Instant scheduledTime;
    private final Frequency frequency;
    private final JobType jobType;
    private final Map<String, Object> parameters;
    private final Integer priority;
    private final Integer maxRetries;
    
    private JobUpdate(Builder builder) {
        this.scheduleType = builder.scheduleType;
        this.scheduledTime = builder.scheduledTime;
        this.frequency = builder.frequency;
        this.jobType = builder.jobType;
        this.parameters = builder.parameters;
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
    }
    
    public ScheduleType getScheduleType() { return scheduleType; }
    public Instant getScheduledTime() { return scheduledTime; }
    public Frequency getFrequency() { return frequency; }
    public JobType getJobType() { return jobType; }
    public Map<String, Object> getParameters() { return parameters; }
    public Integer getPriority() { return priority; }
    public Integer getMaxRetries() { return maxRetries; }
    
    /**
     * Whether the update touches any field other than schedule type, scheduled time and frequency
     */
    public boolean touchesNonScheduleFields() {
        return jobType != null || parameters != null || priority != null || maxRetries != null;
    }
    
    public static class Builder {
        private ScheduleType scheduleType;
        private Instant scheduledTime;
        private Frequency frequency;
        private JobType jobType;
        private Map<String, Object> parameters;
        private Integer priority;
        private Integer maxRetries;
        
        public Builder scheduleType(ScheduleType scheduleType) {
            this.scheduleType = scheduleType;
            return this;
        }
        
        public Builder scheduledTime(Instant scheduledTime) {
            this.scheduledTime = scheduledTime;
            return this;
        }
        
        public Builder frequency(Frequency frequency) {
            this.frequency = frequency;
            return this;
        }
        
        public Builder jobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }
        
        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }
        
        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }
        
        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public JobUpdate build() {
            return new JobUpdate(this);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
