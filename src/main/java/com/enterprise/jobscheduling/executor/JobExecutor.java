package com.enterprise.jobscheduling.executor;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.handler.HandlerRegistry;
import com.enterprise.jobscheduling.monitoring.MetricsCollector;
import com.enterprise.jobscheduling.notify.JobStatusEvent;
import com.enterprise.jobscheduling.notify.JobStatusNotifier;
import com.enterprise.jobscheduling.persistence.JobRepository;
import com.enterprise.jobscheduling.queue.JobQueue;
import com.enterprise.jobscheduling.queue.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one execution of a job: marks it running, dispatches to its handler, records the outcome
 * and resubmits failed executions with backoff.
 * <p>
 * Every state change is written through {@link JobRepository#update} and then published.
 * Publishing never affects the state change that produced it.
 */
public class JobExecutor implements JobRunner {

    private static final Logger logger = LoggerFactory.getLogger(JobExecutor.class);

    public static final String ERROR_KEY = "error";

    private final JobRepository repository;
    private final HandlerRegistry handlers;
    private final JobQueue queue;
    private final JobStatusNotifier notifier;
    private final RetryPolicy retryPolicy;
    private final MetricsCollector metrics;

    public JobExecutor(JobRepository repository, HandlerRegistry handlers, JobQueue queue,
                       JobStatusNotifier notifier, RetryPolicy retryPolicy, MetricsCollector metrics) {
        this.repository = repository;
        this.handlers = handlers;
        this.queue = queue;
        this.notifier = notifier;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    @Override
    public void run(UUID jobId) {
        Optional<Job> started = repository.update(jobId, job -> job.withStatus(JobStatus.RUNNING));
        if (started.isEmpty()) {
            onDeleted(jobId);
            return;
        }

        Job job = started.get();
        logger.info("Executing job {} of type {}", jobId, job.getJobType());
        metrics.recordJobStarted(job);
        publish(job);

        long startTime = System.currentTimeMillis();
        Map<String, Object> result = null;
        Exception failure = null;
        try {
            result = handlers.handlerFor(job.getJobType()).handle(job);
        } catch (Exception e) {
            failure = e;
        }
        long executionTime = System.currentTimeMillis() - startTime;

        // The interrupt is restored only after the outcome is stored: the file channel
        // of the repository closes when an interrupted thread writes to it.
        boolean interrupted = Thread.interrupted() || failure instanceof InterruptedException;
        try {
            if (failure != null) {
                onFailure(job, failure, executionTime);
            } else {
                onSuccess(jobId, result, executionTime);
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void onSuccess(UUID jobId, Map<String, Object> result, long executionTime) {
        Map<String, Object> output = result != null ? result : Map.of();
        Optional<Job> completed = repository.update(jobId, current -> current.toBuilder()
            .status(JobStatus.COMPLETED)
            .result(output)
            .build());
        if (completed.isEmpty()) {
            onDeleted(jobId);
            return;
        }

        logger.info("Job {} completed in {}ms", jobId, executionTime);
        metrics.recordJobCompleted(completed.get(), executionTime);
        publish(completed.get());
    }

    private void onFailure(Job job, Exception failure, long executionTime) {
        UUID jobId = job.getId();
        Map<String, Object> result = errorResult(failure);

        if (!retryPolicy.isRetryable(failure)) {
            Optional<Job> failed = repository.update(jobId, current -> current.toBuilder()
                .status(JobStatus.FAILED)
                .result(result)
                .build());
            if (failed.isEmpty()) {
                onDeleted(jobId);
                return;
            }
            logger.warn("Job {} failed without retry: {}", jobId, failure.getMessage());
            metrics.recordJobFailed(failed.get(), executionTime);
            publish(failed.get());
            return;
        }

        Optional<Job> failed = repository.update(jobId, current -> current.toBuilder()
            .status(JobStatus.FAILED)
            .retries(current.getRetries() + 1)
            .result(result)
            .build());
        if (failed.isEmpty()) {
            onDeleted(jobId);
            return;
        }

        Job failedJob = failed.get();
        logger.warn("Job {} failed (attempt {} of {}): {}", jobId, failedJob.getRetries(),
                    failedJob.getMaxRetries() + 1, failure.getMessage(), failure);
        metrics.recordJobFailed(failedJob, executionTime);
        publish(failedJob);

        if (!retryPolicy.shouldRetry(failedJob)) {
            logger.error("Job {} exhausted its {} retries and stays failed", jobId, failedJob.getMaxRetries());
            return;
        }

        Duration delay = retryPolicy.getRetryDelay(failedJob);
        try {
            queue.enqueueAfter(jobId, delay);
            metrics.recordJobRetried(failedJob, delay);
            logger.info("Job {} will be retried in {}ms", jobId, delay.toMillis());
        } catch (RuntimeException e) {
            logger.error("Failed to resubmit job {} for retry", jobId, e);
        }
    }

    private void onDeleted(UUID jobId) {
        logger.info("Job {} no longer exists, skipping execution", jobId);
        metrics.recordDeletedBeforeRun(jobId);
        publish(JobStatusEvent.deleted(jobId));
    }

    private void publish(Job job) {
        publish(JobStatusEvent.of(job));
    }

    private void publish(JobStatusEvent event) {
        try {
            notifier.publish(event);
        } catch (RuntimeException e) {
            logger.warn("Failed to publish status {} for job {}", event.getStatus(), event.getId(), e);
        }
    }

    private static Map<String, Object> errorResult(Exception failure) {
        Map<String, Object> result = new HashMap<>();
        String message = failure.getMessage();
        result.put(ERROR_KEY, message != null ? message : failure.getClass().getSimpleName());
        return result;
    }
}
