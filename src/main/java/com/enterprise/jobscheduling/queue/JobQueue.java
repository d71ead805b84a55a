package com.enterprise.jobscheduling.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Queue of job executions. Only job ids travel through the queue; the executor loads the job at run time.
 */
public interface JobQueue {
    
    /**
     * Enqueue an execution to start as soon as a worker is free
     */
    void enqueueNow(UUID jobId);
    
    /**
     * Enqueue an execution that must not start before the given instant
     */
    void enqueueAt(UUID jobId, Instant instant);
    
    /**
     * Enqueue an execution that must not start before the delay has elapsed
     */
    void enqueueAfter(UUID jobId, Duration delay);
    
    /**
     * Drop queued and delayed executions of a job that have not started yet.
     * An execution already running is not interrupted.
     * @return true if anything was dropped
     */
    boolean cancel(UUID jobId);
}
