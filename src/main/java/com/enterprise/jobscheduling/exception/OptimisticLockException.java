package com.enterprise.jobscheduling.exception;

import java.util.UUID;

/**
 * Thrown by the repository when a save carries a stale version
 */
public class OptimisticLockException extends RuntimeException {
    
    private final UUID jobId;
    private final long expectedVersion;
    private final long actualVersion;
    
    public OptimisticLockException(UUID jobId, long expectedVersion, long actualVersion) {
        super(String.format("Job %s was modified concurrently (expected version %d, found %d)",
            jobId, expectedVersion, actualVersion));
        this.jobId = jobId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
    
    public UUID getJobId() { return jobId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion() { return actualVersion; }
}
