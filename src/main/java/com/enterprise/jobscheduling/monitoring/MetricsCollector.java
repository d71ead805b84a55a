package com.enterprise.jobscheduling.monitoring;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for job scheduling and execution
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> jobTypeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<JobType, Timer> jobTypeTimers = new ConcurrentHashMap<>();

    private final Counter jobsCreated;
    private final Counter jobsStarted;
    private final Counter jobsCompleted;
    private final Counter jobsFailed;
    private final Counter jobsRetried;
    private final Counter jobsDeletedBeforeRun;
    private final Counter triggersFired;

    private final Timer jobExecutionTime;

    private final AtomicLong queueSize = new AtomicLong(0);
    private final AtomicLong delayedRuns = new AtomicLong(0);

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.jobsCreated = Counter.builder("jobscheduling.jobs.created")
            .description("Total number of jobs created")
            .register(meterRegistry);

        this.jobsStarted = Counter.builder("jobscheduling.jobs.started")
            .description("Total number of job executions started")
            .register(meterRegistry);

        this.jobsCompleted = Counter.builder("jobscheduling.jobs.completed")
            .description("Total number of job executions that completed")
            .register(meterRegistry);

        this.jobsFailed = Counter.builder("jobscheduling.jobs.failed")
            .description("Total number of job executions that failed")
            .register(meterRegistry);

        this.jobsRetried = Counter.builder("jobscheduling.jobs.retried")
            .description("Total number of automatic and manual retries")
            .register(meterRegistry);

        this.jobsDeletedBeforeRun = Counter.builder("jobscheduling.jobs.deleted.before.run")
            .description("Executions that found their job already deleted")
            .register(meterRegistry);

        this.triggersFired = Counter.builder("jobscheduling.triggers.fired")
            .description("Total number of trigger fire events")
            .register(meterRegistry);

        this.jobExecutionTime = Timer.builder("jobscheduling.job.execution.time")
            .description("Job execution time")
            .register(meterRegistry);

        Gauge.builder("jobscheduling.queue.size", queueSize, AtomicLong::get)
            .description("Ready executions waiting for a worker")
            .register(meterRegistry);

        Gauge.builder("jobscheduling.queue.delayed", delayedRuns, AtomicLong::get)
            .description("Executions waiting for their start time")
            .register(meterRegistry);

        logger.info("MetricsCollector initialized");
    }

    public void recordJobCreated(Job job) {
        jobsCreated.increment();
        getJobTypeCounter(job.getJobType(), "created").increment();
    }

    public void recordJobStarted(Job job) {
        jobsStarted.increment();
        getJobTypeCounter(job.getJobType(), "started").increment();
    }

    public void recordJobCompleted(Job job, long executionTimeMs) {
        jobsCompleted.increment();
        getJobTypeCounter(job.getJobType(), "completed").increment();
        recordExecutionTime(job.getJobType(), executionTimeMs);

        logger.debug("Recorded completion of job {} in {}ms", job.getId(), executionTimeMs);
    }

    public void recordJobFailed(Job job, long executionTimeMs) {
        jobsFailed.increment();
        getJobTypeCounter(job.getJobType(), "failed").increment();
        recordExecutionTime(job.getJobType(), executionTimeMs);

        logger.debug("Recorded failure of job {} after {}ms", job.getId(), executionTimeMs);
    }

    public void recordJobRetried(Job job, Duration delay) {
        jobsRetried.increment();
        getJobTypeCounter(job.getJobType(), "retried").increment();

        logger.debug("Recorded retry of job {} (attempt {}, delay {}ms)", job.getId(), job.getRetries(), delay.toMillis());
    }

    public void recordDeletedBeforeRun(UUID jobId) {
        jobsDeletedBeforeRun.increment();
        logger.debug("Recorded execution of deleted job {}", jobId);
    }

    public void recordTriggerFired() {
        triggersFired.increment();
    }

    /**
     * Update queue gauges
     */
    public void updateQueueSize(int ready, int delayed) {
        queueSize.set(ready);
        delayedRuns.set(delayed);
    }

    private void recordExecutionTime(JobType jobType, long executionTimeMs) {
        jobExecutionTime.record(executionTimeMs, TimeUnit.MILLISECONDS);
        getJobTypeTimer(jobType).record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    private Counter getJobTypeCounter(JobType jobType, String event) {
        String key = jobType.getValue() + "." + event;
        return jobTypeCounters.computeIfAbsent(key, k ->
            Counter.builder("jobscheduling.job.type")
                .tag("type", jobType.getValue())
                .tag("event", event)
                .description("Job events by type")
                .register(meterRegistry)
        );
    }

    private Timer getJobTypeTimer(JobType jobType) {
        return jobTypeTimers.computeIfAbsent(jobType, k ->
            Timer.builder("jobscheduling.job.type.execution.time")
                .tag("type", jobType.getValue())
                .description("Job execution time by type")
                .register(meterRegistry)
        );
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /**
     * Snapshot of the core metrics
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("jobs.created", jobsCreated.count());
        metrics.put("jobs.started", jobsStarted.count());
        metrics.put("jobs.completed", jobsCompleted.count());
        metrics.put("jobs.failed", jobsFailed.count());
        metrics.put("jobs.retried", jobsRetried.count());
        metrics.put("jobs.deleted_before_run", jobsDeletedBeforeRun.count());
        metrics.put("triggers.fired", triggersFired.count());

        metrics.put("job.execution.time.mean", jobExecutionTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("job.execution.time.max", jobExecutionTime.max(TimeUnit.MILLISECONDS));

        metrics.put("queue.size", queueSize.get());
        metrics.put("queue.delayed", delayedRuns.get());

        return metrics;
    }
}
