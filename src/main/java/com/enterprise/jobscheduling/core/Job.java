package com.enterprise.jobscheduling.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted unit of work and its execution state.
 * Jobs are immutable; state transitions produce modified copies through the {@code with*} methods.
 */
public final class Job {

    public static final int DEFAULT_PRIORITY = 5;
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final UUID id;
    private final JobType jobType;
    private final Map<String, Object> parameters;
    private final JobStatus status;
    private final int priority;
    private final int maxRetries;
    private final int retries;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Map<String, Object> result;
    private final ScheduleType scheduleType;
    private final Instant scheduledTime;
    private final Frequency frequency;
    private final long version;

    @JsonCreator
    public Job(@JsonProperty("id") UUID id,
               @JsonProperty("job_type") JobType jobType,
               @JsonProperty("parameters") Map<String, Object> parameters,
               @JsonProperty("status") JobStatus status,
               @JsonProperty("priority") int priority,
               @JsonProperty("max_retries") int maxRetries,
               @JsonProperty("retries") int retries,
               @JsonProperty("created_at") Instant createdAt,
               @JsonProperty("updated_at") Instant updatedAt,
               @JsonProperty("result") Map<String, Object> result,
               @JsonProperty("schedule_type") ScheduleType scheduleType,
               @JsonProperty("scheduled_time") Instant scheduledTime,
               @JsonProperty("frequency") Frequency frequency,
               @JsonProperty("version") long version) {
        this.id = Objects.requireNonNull(id, "id");
        this.jobType = Objects.requireNonNull(jobType, "jobType");
        this.parameters = parameters != null
            ? Collections.unmodifiableMap(new HashMap<>(parameters))
            : Collections.emptyMap();
        this.status = status != null ? status : JobStatus.PENDING;
        this.priority = priority;
        this.maxRetries = maxRetries;
        this.retries = retries;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.result = result != null ? Collections.unmodifiableMap(new HashMap<>(result)) : null;
        this.scheduleType = scheduleType != null ? scheduleType : ScheduleType.IMMEDIATE;
        this.scheduledTime = scheduledTime;
        this.frequency = frequency;
        this.version = version;
    }

    @JsonProperty("id")
    public UUID getId() { return id; }

    @JsonProperty("job_type")
    public JobType getJobType() { return jobType; }

    @JsonProperty("parameters")
    public Map<String, Object> getParameters() { return parameters; }

    @JsonProperty("status")
    public JobStatus getStatus() { return status; }

    /**
     * Advisory ordering hint for queue consumers, higher runs first
     */
    @JsonProperty("priority")
    public int getPriority() { return priority; }

    @JsonProperty("max_retries")
    public int getMaxRetries() { return maxRetries; }

    /**
     * Number of failed executions since creation or the last manual retry
     */
    @JsonProperty("retries")
    public int getRetries() { return retries; }

    @JsonProperty("created_at")
    public Instant getCreatedAt() { return createdAt; }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Success output or failure reason, null until the job reaches a terminal state
     */
    @JsonProperty("result")
    public Map<String, Object> getResult() { return result; }

    @JsonProperty("schedule_type")
    public ScheduleType getScheduleType() { return scheduleType; }

    @JsonProperty("scheduled_time")
    public Instant getScheduledTime() { return scheduledTime; }

    @JsonProperty("frequency")
    public Frequency getFrequency() { return frequency; }

    /**
     * Optimistic lock counter, maintained by the repository
     */
    @JsonProperty("version")
    public long getVersion() { return version; }

    @JsonIgnore
    public String getParameter(String key) {
        Object value = parameters.get(key);
        return value != null ? value.toString() : null;
    }

    public Job withStatus(JobStatus status) {
        return toBuilder().status(status).build();
    }

    public Job withResult(Map<String, Object> result) {
        return toBuilder().result(result).build();
    }

    public Job withRetries(int retries) {
        return toBuilder().retries(retries).build();
    }

    public Job withSchedule(ScheduleType scheduleType, Instant scheduledTime, Frequency frequency) {
        return toBuilder()
            .scheduleType(scheduleType)
            .scheduledTime(scheduledTime)
            .frequency(frequency)
            .build();
    }

    public Job withTimestamps(Instant createdAt, Instant updatedAt) {
        return toBuilder().createdAt(createdAt).updatedAt(updatedAt).build();
    }

    public Job withVersion(long version) {
        return toBuilder().version(version).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .jobType(jobType)
            .parameters(parameters)
            .status(status)
            .priority(priority)
            .maxRetries(maxRetries)
            .retries(retries)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .result(result)
            .scheduleType(scheduleType)
            .scheduledTime(scheduledTime)
            .frequency(frequency)
            .version(version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Job)) return false;
        Job other = (Job) o;
        return id.equals(other.id) && version == other.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return String.format("Job[id=%s, type=%s, status=%s, schedule=%s, priority=%d, retries=%d/%d]",
            id, jobType, status, scheduleType, priority, retries, maxRetries);
    }

    /**
     * Builder for creating Job instances
     */
    public static class Builder {
        private UUID id = UUID.randomUUID();
        private JobType jobType;
        private Map<String, Object> parameters;
        private JobStatus status = JobStatus.PENDING;
        private int priority = DEFAULT_PRIORITY;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private int retries = 0;
        private Instant createdAt;
        private Instant updatedAt;
        private Map<String, Object> result;
        private ScheduleType scheduleType = ScheduleType.IMMEDIATE;
        private Instant scheduledTime;
        private Frequency frequency;
        private long version = 0;

        public Builder id(UUID id) {
            this.id = id;
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

        public Builder status(JobStatus status) {
            this.status = status;
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

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
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

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Job build() {
            if (jobType == null) {
                throw new IllegalArgumentException("Job type is required");
            }
            return new Job(id, jobType, parameters, status, priority, maxRetries, retries,
                          createdAt, updatedAt, result, scheduleType, scheduledTime, frequency, version);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
