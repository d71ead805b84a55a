package com.enterprise.jobscheduling.notify;

import com.enterprise.jobscheduling.core.Job;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Status change of one job, as broadcast to observers.
 * Besides the job statuses, {@value #DELETED} reports a job that vanished before it could run.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class JobStatusEvent {
    
    public static final String DELETED = "deleted";
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private final UUID id;
    private final String status;
    private final Map<String, Object> result;
    
    @JsonCreator
    public JobStatusEvent(@JsonProperty("id") UUID id,
                          @JsonProperty("status") String status,
                          @JsonProperty("result") Map<String, Object> result) {
        this.id = Objects.requireNonNull(id, "id");
        this.status = Objects.requireNonNull(status, "status");
        this.result = result != null ? Collections.unmodifiableMap(new HashMap<>(result)) : null;
    }
    
    public static JobStatusEvent of(Job job) {
        return new JobStatusEvent(job.getId(), job.getStatus().getValue(), job.getResult());
    }
    
    public static JobStatusEvent deleted(UUID jobId) {
        return new JobStatusEvent(jobId, DELETED, null);
    }
    
    @JsonProperty("id")
    public UUID getId() { return id; }
    
    @JsonProperty("status")
    public String getStatus() { return status; }
    
    @JsonProperty("result")
    public Map<String, Object> getResult() { return result; }
    
    /**
     * Wire form for broker or socket transports
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize status event for job " + id, e);
        }
    }
    
    public static JobStatusEvent fromJson(String json) {
        try {
            return MAPPER.readValue(json, JobStatusEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed status event: " + json, e);
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobStatusEvent)) return false;
        JobStatusEvent other = (JobStatusEvent) o;
        return id.equals(other.id) && status.equals(other.status) && Objects.equals(result, other.result);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, status, result);
    }
    
    @Override
    public String toString() {
        return "JobStatusEvent[id=" + id + ", status=" + status + ", result=" + result + "]";
    }
}
