package com.enterprise.jobscheduling.service;

import com.enterprise.jobscheduling.core.JobStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job counts: the total and one count per status
 */
public final class JobStats {
    
    private final long total;
    private final Map<JobStatus, Long> byStatus;
    
    public JobStats(long total, Map<JobStatus, Long> byStatus) {
        this.total = total;
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, byStatus.getOrDefault(status, 0L));
        }
        this.byStatus = Collections.unmodifiableMap(counts);
    }
    
    public long getTotal() { return total; }
    
    public long getCount(JobStatus status) {
        return byStatus.get(status);
    }
    
    public long getPending() { return getCount(JobStatus.PENDING); }
    public long getRunning() { return getCount(JobStatus.RUNNING); }
    public long getCompleted() { return getCount(JobStatus.COMPLETED); }
    public long getFailed() { return getCount(JobStatus.FAILED); }
    
    public Map<JobStatus, Long> getByStatus() { return byStatus; }
    
    /**
     * Flat form keyed by {@code total} and the status values
     */
    public Map<String, Long> toMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        map.put("total", total);
        byStatus.forEach((status, count) -> map.put(status.getValue(), count));
        return map;
    }
    
    @Override
    public String toString() {
        return "JobStats" + toMap();
    }
}
