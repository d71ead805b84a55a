package com.enterprise.jobscheduling.service;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.core.ScheduleType;
import com.enterprise.jobscheduling.dispatch.Dispatcher;
import com.enterprise.jobscheduling.exception.InvalidScheduleException;
import com.enterprise.jobscheduling.exception.InvalidStateException;
import com.enterprise.jobscheduling.exception.JobNotFoundException;
import com.enterprise.jobscheduling.exception.JobSchedulingException;
import com.enterprise.jobscheduling.exception.OptimisticLockException;
import com.enterprise.jobscheduling.exception.ValidationException;
import com.enterprise.jobscheduling.handler.SendEmailHandler;
import com.enterprise.jobscheduling.handler.UploadFileHandler;
import com.enterprise.jobscheduling.monitoring.MetricsCollector;
import com.enterprise.jobscheduling.notify.JobStatusEvent;
import com.enterprise.jobscheduling.notify.JobStatusNotifier;
import com.enterprise.jobscheduling.persistence.JobQuery;
import com.enterprise.jobscheduling.persistence.JobRepository;
import com.enterprise.jobscheduling.persistence.Page;
import com.enterprise.jobscheduling.schedule.FirePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Job-facing operations: submission, listing, schedule updates, deletion, manual retry and statistics.
 * <p>
 * Validation and state-gate failures are thrown to the caller. Execution failures never are;
 * they show up in the job's status and result.
 */
public class JobService {

    private static final Logger logger = LoggerFactory.getLogger(JobService.class);

    private final JobRepository repository;
    private final Dispatcher dispatcher;
    private final JobStatusNotifier notifier;
    private final JobRequestValidator validator;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final Path uploadDir;

    public JobService(JobRepository repository, Dispatcher dispatcher, JobStatusNotifier notifier,
                      JobRequestValidator validator, MetricsCollector metrics, Clock clock, Path uploadDir) {
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.notifier = notifier;
        this.validator = validator;
        this.metrics = metrics;
        this.clock = clock;
        this.uploadDir = uploadDir;
    }

    /**
     * Validate, persist and schedule a job
     * @throws ValidationException if the request is incomplete or inconsistent; nothing is stored
     */
    public Job createJob(JobRequest request) throws JobSchedulingException {
        validator.validate(request, clock.instant());
        return submit(request.toJob());
    }

    /**
     * Create several jobs. Every request is validated before any job is stored.
     */
    public List<Job> createJobs(List<JobRequest> requests) throws JobSchedulingException {
        if (requests == null || requests.isEmpty()) {
            throw new ValidationException("jobs", "At least one job is required");
        }

        Instant now = clock.instant();
        for (int i = 0; i < requests.size(); i++) {
            try {
                validator.validate(requests.get(i), now);
            } catch (ValidationException e) {
                throw new ValidationException("jobs[" + i + "]." + e.getField(), e.getReason());
            }
        }

        List<Job> created = new ArrayList<>(requests.size());
        for (JobRequest request : requests) {
            created.add(submit(request.toJob()));
        }
        logger.info("Created {} jobs in bulk", created.size());
        return created;
    }

    /**
     * Create one send_email job per recipient
     * @param options priority, retry and schedule settings applied to every job, may be null
     */
    public List<Job> createEmailJobs(List<String> recipients, String subject, String body,
                                     JobRequest options) throws JobSchedulingException {
        validator.validateRecipients(recipients);

        JobRequest.Builder template = options != null ? options.toBuilder() : JobRequest.builder();
        List<JobRequest> requests = new ArrayList<>(recipients.size());
        for (String recipient : recipients) {
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put(SendEmailHandler.RECIPIENT, recipient.trim());
            parameters.put(SendEmailHandler.SUBJECT, subject != null ? subject : "");
            parameters.put(SendEmailHandler.BODY, body != null ? body : "");
            requests.add(template.jobType(JobType.SEND_EMAIL).parameters(parameters).build());
        }
        return createJobs(requests);
    }

    /**
     * Store an uploaded file in the upload directory and create the upload_file job that moves it
     * to object storage
     * @param options priority, retry and schedule settings, may be null
     */
    public Job createUploadJob(String fileName, byte[] content, JobRequest options) throws JobSchedulingException {
        validator.validateUpload(fileName, content);

        Path tempPath = uploadDir.resolve(UUID.randomUUID() + "-" + fileName);
        JobRequest request = (options != null ? options.toBuilder() : JobRequest.builder())
            .jobType(JobType.UPLOAD_FILE)
            .parameters(Map.of(
                UploadFileHandler.FILE_NAME, fileName,
                UploadFileHandler.TEMP_PATH, tempPath.toString()))
            .build();
        validator.validate(request, clock.instant());

        try {
            Files.createDirectories(uploadDir);
            Files.write(tempPath, content);
        } catch (IOException e) {
            throw new JobSchedulingException("Failed to store upload " + fileName, e);
        }

        try {
            return submit(request.toJob());
        } catch (JobSchedulingException | RuntimeException e) {
            deleteQuietly(tempPath);
            throw e;
        }
    }

    public Page<Job> listJobs(JobQuery query) {
        return repository.query(query != null ? query : JobQuery.all());
    }

    public Job getJob(UUID id) throws JobNotFoundException {
        return repository.load(id);
    }

    /**
     * Change the schedule of a pending scheduled or interval job and re-arm its triggers
     * @throws InvalidStateException if the job is not pending, is immediate, if a field other than
     *         the schedule fields is touched, or if the job changed concurrently
     * @throws ValidationException if the new schedule is invalid
     */
    public Job updateJob(UUID id, JobUpdate update) throws JobSchedulingException {
        Job job = repository.load(id);

        if (update.touchesNonScheduleFields()) {
            throw new InvalidStateException(id, job.getStatus(),
                "Only scheduled_time, frequency and schedule_type can be updated");
        }
        if (job.getStatus() != JobStatus.PENDING) {
            throw new InvalidStateException(id, job.getStatus(),
                "Only pending jobs can be updated, job is " + job.getStatus());
        }
        if (!job.getScheduleType().isReschedulable()) {
            throw new InvalidStateException(id, job.getStatus(), "Immediate jobs cannot be rescheduled");
        }

        ScheduleType scheduleType = update.getScheduleType() != null ? update.getScheduleType() : job.getScheduleType();
        Instant scheduledTime = update.getScheduledTime() != null ? update.getScheduledTime() : job.getScheduledTime();
        Frequency frequency = update.getFrequency() != null
            ? update.getFrequency()
            : (scheduleType == ScheduleType.INTERVAL ? job.getFrequency() : null);

        if (scheduleType == ScheduleType.IMMEDIATE) {
            throw new ValidationException("schedule_type", "A job cannot be switched to immediate execution");
        }
        validator.validateSchedule(scheduleType, scheduledTime, frequency, clock.instant());

        if (scheduleType == ScheduleType.INTERVAL && scheduledTime == null) {
            scheduledTime = clock.instant();
        }

        boolean changed = scheduleType != job.getScheduleType()
            || !Objects.equals(scheduledTime, job.getScheduledTime())
            || !Objects.equals(frequency, job.getFrequency());
        if (!changed) {
            return job;
        }

        Job saved;
        try {
            saved = repository.save(job.withSchedule(scheduleType, scheduledTime, frequency));
        } catch (OptimisticLockException e) {
            throw new InvalidStateException(id, job.getStatus(), "Job was modified concurrently, reload and try again");
        }

        FirePlan plan = dispatcher.reschedule(saved);
        logger.info("Updated schedule of job {} to {} {} {}, {}", id, scheduleType, scheduledTime, frequency, plan);
        return saved;
    }

    /**
     * Cancel every trigger of the job, then delete it
     */
    public void deleteJob(UUID id) throws JobNotFoundException {
        if (repository.find(id).isEmpty()) {
            throw new JobNotFoundException(id);
        }
        dispatcher.cancel(id);
        if (!repository.delete(id)) {
            throw new JobNotFoundException(id);
        }
        logger.info("Deleted job {}", id);
    }

    /**
     * Reset a failed job to pending with a fresh retry budget and run it now
     * @throws InvalidStateException if the job has not failed
     */
    public Job retryJob(UUID id) throws JobSchedulingException {
        Job job = repository.load(id);
        if (job.getStatus() != JobStatus.FAILED) {
            throw new InvalidStateException(id, job.getStatus(), "Only failed jobs can be retried.");
        }

        Job saved;
        try {
            saved = repository.save(job.toBuilder().status(JobStatus.PENDING).retries(0).build());
        } catch (OptimisticLockException e) {
            throw new InvalidStateException(id, job.getStatus(), "Job was modified concurrently, reload and try again");
        }

        metrics.recordJobRetried(saved, Duration.ZERO);
        publish(saved);
        dispatcher.runNow(id);
        logger.info("Job {} manually retried", id);
        return saved;
    }

    public JobStats getStats() {
        Map<JobStatus, Long> counts = repository.countByStatus();
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new JobStats(total, counts);
    }

    /**
     * Download URL of a completed upload, empty for other jobs or before the upload ran
     */
    public Optional<String> getFileUrl(UUID id) throws JobNotFoundException {
        Job job = repository.load(id);
        if (job.getJobType() != JobType.UPLOAD_FILE || job.getResult() == null) {
            return Optional.empty();
        }
        Object url = job.getResult().get(UploadFileHandler.FILE_URL);
        return url != null ? Optional.of(url.toString()) : Optional.empty();
    }

    /**
     * Supported job types, value to display label
     */
    public Map<String, String> listJobTypes() {
        Map<String, String> types = new LinkedHashMap<>();
        for (JobType type : JobType.values()) {
            types.put(type.getValue(), type.getLabel());
        }
        return types;
    }

    private Job submit(Job job) throws InvalidScheduleException {
        Job saved = repository.save(withReferenceTime(job));
        metrics.recordJobCreated(saved);
        try {
            FirePlan plan = dispatcher.schedule(saved);
            logger.info("Created job {} of type {}: {}", saved.getId(), saved.getJobType(), plan);
        } catch (InvalidScheduleException | RuntimeException e) {
            logger.error("Failed to schedule job {}, removing it", saved.getId(), e);
            dispatcher.cancel(saved.getId());
            repository.delete(saved.getId());
            throw e;
        }
        return saved;
    }

    // Interval rules are derived from the stored time, so a job without one keeps its creation time
    private Job withReferenceTime(Job job) {
        if (job.getScheduleType() == ScheduleType.INTERVAL && job.getScheduledTime() == null) {
            return job.withSchedule(ScheduleType.INTERVAL, clock.instant(), job.getFrequency());
        }
        return job;
    }

    private void publish(Job job) {
        try {
            notifier.publish(JobStatusEvent.of(job));
        } catch (RuntimeException e) {
            logger.warn("Failed to publish status of job {}", job.getId(), e);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove upload {}", path, e);
        }
    }
}
