package com.enterprise.jobscheduling.persistence;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.exception.JobNotFoundException;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Persistence boundary for jobs.
 * Every write bumps the job's version and sets {@code updatedAt}.
 */
public interface JobRepository {
    
    Optional<Job> find(UUID id);
    
    /**
     * Load a job that must exist
     */
    default Job load(UUID id) throws JobNotFoundException {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }
    
    /**
     * Insert a new job or replace a stored one.
     * Replacing requires the job to carry the stored version.
     * @throws com.enterprise.jobscheduling.exception.OptimisticLockException if the version is stale
     */
    Job save(Job job);
    
    /**
     * Atomically apply a mutation to the stored job
     * @return the updated job, or empty if the job no longer exists
     */
    Optional<Job> update(UUID id, UnaryOperator<Job> mutation);
    
    /**
     * @return false if the job did not exist
     */
    boolean delete(UUID id);
    
    Page<Job> query(JobQuery query);
    
    /**
     * Job counts for every status, including zero counts
     */
    Map<JobStatus, Long> countByStatus();
    
    long count();
}
