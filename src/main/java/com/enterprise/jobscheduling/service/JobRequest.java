package com.enterprise.jobscheduling.service;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.core.ScheduleType;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Client submission of a new job
 */
public final class JobRequest {
    
    private final JobType jobType;
    private final Map<String, Object> parameters;
    private final int priority;
    private final int maxRetries;
    private final ScheduleType scheduleType;
    private final Instant scheduledTime;
    private final Frequency frequency;
    
    private JobRequest(Builder builder) {
        this.jobType = builder.jobType;
        this.parameters = Collections.unmodifiableMap(new HashMap<>(builder.parameters));
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
        this.scheduleType = builder.scheduleType;
        this.scheduledTime = builder.scheduledTime;
        this.frequency = builder.frequency;
    }
    
    public JobType getJobType() { return jobType; }
    public Map<String, Object> getParameters() { return parameters; }
    public int getPriority() { return priority; }
    public int getMaxRetries() { return maxRetries; }
    public ScheduleType getScheduleType() { return scheduleType; }
    public Instant getScheduledTime() { return scheduledTime; }
    public Frequency getFrequency() { return frequency; }
    
    public String getParameter(String key) {
        Object value = parameters.get(key);
        return value != null ? value.toString() : null;
    }
    
    /**
     * Pending job carrying this request's fields
     */
    Job toJob() {
        return Job.builder()
            .jobType(jobType)
            .parameters(parameters)
            .priority(priority)
            .maxRetries(maxRetries)
            .scheduleType(scheduleType)
            .scheduledTime(scheduledTime)
            .frequency(frequency)
            .build();
    }
    
    public Builder toBuilder() {
        return new Builder()
            .jobType(jobType)
            .parameters(parameters)
            .priority(priority)
            .maxRetries(maxRetries)
            .scheduleType(scheduleType)
            .scheduledTime(scheduledTime)
            .frequency(frequency);
    }
    
    @Override
    public String toString() {
        return String.format("JobRequest[type=%s, schedule=%s, time=%s, frequency=%s, priority=%d]",
            jobType, scheduleType, scheduledTime, frequency, priority);
    }
    
    /**
     * Builder for job requests. Defaults match the job defaults: immediate, priority 5, 3 retries.
     */
    public static class Builder {
        private JobType jobType;
        private Map<String, Object> parameters = new HashMap<>();
        private int priority = Job.DEFAULT_PRIORITY;
        private int maxRetries = Job.DEFAULT_MAX_RETRIES;
        private ScheduleType scheduleType = ScheduleType.IMMEDIATE;
        private Instant scheduledTime;
        private Frequency frequency;
        
        public Builder jobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }
        
        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters != null ? new HashMap<>(parameters) : new HashMap<>();
            return this;
        }
        
        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }
        
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }
        
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
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
        
        public JobRequest build() {
            return new JobRequest(this);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static Builder builder(JobType jobType) {
        return new Builder().jobType(jobType);
    }
}
