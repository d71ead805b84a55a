package com.enterprise.jobscheduling.service;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.core.ScheduleType;
import com.enterprise.jobscheduling.dispatch.Dispatcher;
import com.enterprise.jobscheduling.exception.InvalidStateException;
import com.enterprise.jobscheduling.exception.JobNotFoundException;
import com.enterprise.jobscheduling.exception.ValidationException;
import com.enterprise.jobscheduling.monitoring.MetricsCollector;
import com.enterprise.jobscheduling.persistence.JobQuery;
import com.enterprise.jobscheduling.persistence.MapDBJobRepository;
import com.enterprise.jobscheduling.persistence.Page;
import com.enterprise.jobscheduling.schedule.ScheduleResolver;
import com.enterprise.jobscheduling.support.MutableClock;
import com.enterprise.jobscheduling.support.RecordingJobQueue;
import com.enterprise.jobscheduling.support.RecordingNotifier;
import com.enterprise.jobscheduling.trigger.CronTriggerStore;
import com.enterprise.jobscheduling.trigger.TriggerNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

class JobServiceTest {
    
    private static final Instant NOW = Instant.parse("2030-03-01T12:00:00Z");
    
    @TempDir
    Path tempDir;
    
    private MutableClock clock;
    private MapDBJobRepository repository;
    private CronTriggerStore triggerStore;
    private RecordingJobQueue queue;
    private RecordingNotifier notifier;
    private MetricsCollector metrics;
    private Dispatcher dispatcher;
    private JobService service;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        repository = MapDBJobRepository.inMemory(clock);
        triggerStore = new CronTriggerStore(ZoneOffset.UTC);
        queue = new RecordingJobQueue();
        notifier = new RecordingNotifier();
        service = createService(queue);
    }
    
    @AfterEach
    void tearDown() {
        triggerStore.stop();
        repository.close();
    }
    
    private JobService createService(RecordingJobQueue jobQueue) {
        metrics = new MetricsCollector(new SimpleMeterRegistry());
        dispatcher = new Dispatcher(new ScheduleResolver(ZoneOffset.UTC), triggerStore, jobQueue, clock, metrics);
        return new JobService(repository, dispatcher, notifier, new JobRequestValidator(1024), metrics, clock,
                              tempDir.resolve("uploads"));
    }
    
    @Test
    void testCreateImmediateJob() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.GENERATE_REPORT).priority(8).build());
        
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(8, job.getPriority());
        assertEquals(1, job.getVersion());
        assertEquals(NOW, job.getCreatedAt());
        assertEquals(List.of(job.getId()), queue.immediate);
        assertEquals(1.0, metrics.getMetrics().get("jobs.created"));
    }
    
    @Test
    void testInvalidRequestStoresNothing() {
        assertThrows(ValidationException.class, () -> service.createJob(JobRequest.builder(JobType.FETCH_DATA)
            .scheduleType(ScheduleType.SCHEDULED).scheduledTime(NOW.minusSeconds(1)).build()));
        
        assertEquals(0, repository.count());
        assertEquals(0, queue.totalEnqueued());
    }
    
    @Test
    void testDispatchFailureRemovesJob() {
        RecordingJobQueue broken = new RecordingJobQueue() {
            @Override
            public synchronized void enqueueNow(UUID jobId) {
                throw new IllegalStateException("Job queue is full");
            }
        };
        JobService failing = createService(broken);
        
        assertThrows(IllegalStateException.class, () -> failing.createJob(JobRequest.builder(JobType.FETCH_DATA).build()));
        assertEquals(0, repository.count());
    }
    
    @Test
    void testBulkCreateIsAllOrNothing() {
        List<JobRequest> requests = List.of(
            JobRequest.builder(JobType.FETCH_DATA).build(),
            JobRequest.builder(JobType.SEND_EMAIL).parameter("recipient", "not-an-address").build());
        
        ValidationException e = assertThrows(ValidationException.class, () -> service.createJobs(requests));
        
        assertEquals("jobs[1].recipient", e.getField());
        assertEquals(0, repository.count());
    }
    
    @Test
    void testBulkCreateRequiresJobs() {
        ValidationException e = assertThrows(ValidationException.class, () -> service.createJobs(List.of()));
        assertEquals("jobs", e.getField());
    }
    
    @Test
    void testCreateEmailJobs() throws Exception {
        JobRequest options = JobRequest.builder()
            .scheduleType(ScheduleType.SCHEDULED)
            .scheduledTime(NOW.plusSeconds(600))
            .maxRetries(5)
            .build();
        
        List<Job> jobs = service.createEmailJobs(List.of("ada@example.com", " grace@example.org "),
                                                 "Welcome", "Hello there", options);
        
        assertEquals(2, jobs.size());
        assertEquals("ada@example.com", jobs.get(0).getParameter("recipient"));
        assertEquals("grace@example.org", jobs.get(1).getParameter("recipient"));
        for (Job job : jobs) {
            assertEquals(JobType.SEND_EMAIL, job.getJobType());
            assertEquals("Welcome", job.getParameter("subject"));
            assertEquals(5, job.getMaxRetries());
        }
        assertEquals(2, queue.at.size());
    }
    
    @Test
    void testCreateEmailJobsRejectsBadRecipient() {
        assertThrows(ValidationException.class,
            () -> service.createEmailJobs(List.of("ada@example.com", "oops"), "s", "b", null));
        assertEquals(0, repository.count());
    }
    
    @Test
    void testCreateUploadJob() throws Exception {
        byte[] content = "col1,col2\n".getBytes(StandardCharsets.UTF_8);
        
        Job job = service.createUploadJob("data.csv", content, null);
        
        assertEquals(JobType.UPLOAD_FILE, job.getJobType());
        assertEquals("data.csv", job.getParameter("file_name"));
        Path stored = Paths.get(job.getParameter("temp_path"));
        assertTrue(stored.startsWith(tempDir.resolve("uploads")));
        assertTrue(stored.getFileName().toString().endsWith("-data.csv"));
        assertArrayEquals(content, Files.readAllBytes(stored));
        assertEquals(List.of(job.getId()), queue.immediate);
    }
    
    @Test
    void testUploadOverLimitIsRejected() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> service.createUploadJob("big.bin", new byte[2048], null));
        
        assertEquals("file", e.getField());
        assertFalse(Files.exists(tempDir.resolve("uploads")));
        assertEquals(0, repository.count());
    }
    
    @Test
    void testListAndGetJobs() throws Exception {
        Job report = service.createJob(JobRequest.builder(JobType.GENERATE_REPORT).build());
        service.createJob(JobRequest.builder(JobType.FETCH_DATA).build());
        
        Page<Job> reports = service.listJobs(JobQuery.builder().jobType(JobType.GENERATE_REPORT).build());
        
        assertEquals(1, reports.getTotalItems());
        assertEquals(report.getId(), reports.getItems().get(0).getId());
        assertEquals(2, service.listJobs(null).getTotalItems());
        assertEquals(report, service.getJob(report.getId()));
        assertThrows(JobNotFoundException.class, () -> service.getJob(UUID.randomUUID()));
    }
    
    @Test
    void testUpdateScheduledTime() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        Instant later = NOW.plusSeconds(7200);
        
        Job updated = service.updateJob(job.getId(), JobUpdate.builder().scheduledTime(later).build());
        
        assertEquals(later, updated.getScheduledTime());
        assertEquals(2, updated.getVersion());
        assertEquals(List.of(job.getId()), queue.cancelled);
        assertEquals(later, queue.at.get(queue.at.size() - 1).getValue());
    }
    
    @Test
    void testUpdateScheduledToInterval() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        
        Job updated = service.updateJob(job.getId(), JobUpdate.builder()
            .scheduleType(ScheduleType.INTERVAL)
            .frequency(Frequency.WEEKLY)
            .build());
        
        assertEquals(ScheduleType.INTERVAL, updated.getScheduleType());
        assertEquals(Frequency.WEEKLY, updated.getFrequency());
        assertTrue(triggerStore.find(TriggerNames.jobTrigger(job.getId())).isPresent());
        assertTrue(triggerStore.find(TriggerNames.activationTrigger(job.getId())).isPresent());
    }
    
    @Test
    void testUpdateIntervalToScheduledDropsFrequency() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.BACKUP_DATABASE)
            .scheduleType(ScheduleType.INTERVAL)
            .scheduledTime(NOW.plusSeconds(60))
            .frequency(Frequency.DAILY)
            .build());
        
        Job updated = service.updateJob(job.getId(), JobUpdate.builder()
            .scheduleType(ScheduleType.SCHEDULED)
            .scheduledTime(NOW.plusSeconds(900))
            .build());
        
        assertNull(updated.getFrequency());
        assertTrue(triggerStore.findAll().isEmpty());
    }
    
    @Test
    void testUpdateWithoutChangesKeepsVersion() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        
        Job same = service.updateJob(job.getId(), JobUpdate.builder().scheduledTime(job.getScheduledTime()).build());
        
        assertEquals(1, same.getVersion());
        assertTrue(queue.cancelled.isEmpty());
    }
    
    @Test
    void testUpdateRejectedForNonPendingJob() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        repository.update(job.getId(), current -> current.withStatus(JobStatus.RUNNING));
        
        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> service.updateJob(job.getId(), JobUpdate.builder().scheduledTime(NOW.plusSeconds(60)).build()));
        assertEquals(JobStatus.RUNNING, e.getStatus());
    }
    
    @Test
    void testUpdateRejectedForCompletedJob() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        repository.update(job.getId(), current -> current.withStatus(JobStatus.COMPLETED));
        
        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> service.updateJob(job.getId(), JobUpdate.builder().scheduledTime(NOW.plusSeconds(60)).build()));
        assertEquals(JobStatus.COMPLETED, e.getStatus());
        assertEquals(JobStatus.COMPLETED, repository.load(job.getId()).getStatus());
        assertTrue(queue.cancelled.isEmpty());
    }
    
    @Test
    void testUpdateIntervalFrequencyReschedules() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.CLEANUP_FILES)
            .scheduleType(ScheduleType.INTERVAL)
            .frequency(Frequency.HOURLY)
            .build());
        String jobTrigger = TriggerNames.jobTrigger(job.getId());
        assertEquals("0 * * * *", triggerStore.find(jobTrigger).orElseThrow().getRule().toCronPattern());
        
        Job updated = service.updateJob(job.getId(), JobUpdate.builder().frequency(Frequency.DAILY).build());
        
        assertEquals(Frequency.DAILY, updated.getFrequency());
        assertEquals(ScheduleType.INTERVAL, updated.getScheduleType());
        assertEquals(2, updated.getVersion());
        assertEquals("0 12 * * *", triggerStore.find(jobTrigger).orElseThrow().getRule().toCronPattern());
        assertEquals(List.of(job.getId()), queue.cancelled);
    }
    
    @Test
    void testIntervalJobKeepsCreationTimeAsReference() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.BACKUP_DATABASE)
            .scheduleType(ScheduleType.INTERVAL)
            .frequency(Frequency.DAILY)
            .build());
        String jobTrigger = TriggerNames.jobTrigger(job.getId());
        
        assertEquals(NOW, repository.load(job.getId()).getScheduledTime());
        assertEquals("0 12 * * *", triggerStore.find(jobTrigger).orElseThrow().getRule().toCronPattern());
        
        clock.set(Instant.parse("2030-03-01T17:45:00Z"));
        dispatcher.schedule(repository.load(job.getId()));
        
        assertEquals("0 12 * * *", triggerStore.find(jobTrigger).orElseThrow().getRule().toCronPattern());
    }
    
    @Test
    void testUpdateRejectedForImmediateJob() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.FETCH_DATA).build());
        
        assertThrows(InvalidStateException.class,
            () -> service.updateJob(job.getId(), JobUpdate.builder().scheduledTime(NOW.plusSeconds(60)).build()));
    }
    
    @Test
    void testUpdateRejectsOtherFields() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        
        assertThrows(InvalidStateException.class,
            () -> service.updateJob(job.getId(), JobUpdate.builder().priority(1).build()));
        assertThrows(InvalidStateException.class,
            () -> service.updateJob(job.getId(), JobUpdate.builder().parameters(Map.of("k", "v")).build()));
    }
    
    @Test
    void testUpdateToImmediateIsRejected() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        
        ValidationException e = assertThrows(ValidationException.class,
            () -> service.updateJob(job.getId(), JobUpdate.builder().scheduleType(ScheduleType.IMMEDIATE).build()));
        assertEquals("schedule_type", e.getField());
    }
    
    @Test
    void testUpdateToPastTimeIsRejected() throws Exception {
        Job job = scheduledJob(NOW.plusSeconds(3600));
        
        ValidationException e = assertThrows(ValidationException.class,
            () -> service.updateJob(job.getId(), JobUpdate.builder().scheduledTime(NOW.minusSeconds(5)).build()));
        assertEquals("scheduled_time", e.getField());
        assertEquals(job.getScheduledTime(), repository.load(job.getId()).getScheduledTime());
    }
    
    @Test
    void testDeleteJob() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.BACKUP_DATABASE)
            .scheduleType(ScheduleType.INTERVAL)
            .frequency(Frequency.HOURLY)
            .build());
        
        service.deleteJob(job.getId());
        
        assertEquals(0, repository.count());
        assertTrue(triggerStore.findAll().isEmpty());
        assertTrue(queue.cancelled.contains(job.getId()));
        assertThrows(JobNotFoundException.class, () -> service.deleteJob(job.getId()));
    }
    
    @Test
    void testRetryFailedJob() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.FETCH_DATA).build());
        repository.update(job.getId(), current -> current.toBuilder()
            .status(JobStatus.FAILED)
            .retries(4)
            .result(Map.of("error", "timeout"))
            .build());
        
        Job retried = service.retryJob(job.getId());
        
        assertEquals(JobStatus.PENDING, retried.getStatus());
        assertEquals(0, retried.getRetries());
        assertEquals(List.of(job.getId(), job.getId()), queue.immediate);
        assertEquals(List.of(job.getId()), queue.cancelled);
        assertEquals(List.of("pending"), notifier.statusesFor(job.getId()));
        assertEquals(1.0, metrics.getMetrics().get("jobs.retried"));
    }
    
    @Test
    void testRetryOnlyForFailedJobs() throws Exception {
        Job job = service.createJob(JobRequest.builder(JobType.FETCH_DATA).build());
        
        InvalidStateException e = assertThrows(InvalidStateException.class, () -> service.retryJob(job.getId()));
        assertEquals("Only failed jobs can be retried.", e.getMessage());
        assertThrows(JobNotFoundException.class, () -> service.retryJob(UUID.randomUUID()));
    }
    
    @Test
    void testStats() throws Exception {
        Job a = service.createJob(JobRequest.builder(JobType.FETCH_DATA).build());
        Job b = service.createJob(JobRequest.builder(JobType.FETCH_DATA).build());
        service.createJob(JobRequest.builder(JobType.FETCH_DATA).build());
        repository.update(a.getId(), current -> current.withStatus(JobStatus.COMPLETED));
        repository.update(b.getId(), current -> current.withStatus(JobStatus.FAILED));
        
        JobStats stats = service.getStats();
        
        assertEquals(3, stats.getTotal());
        assertEquals(1, stats.getPending());
        assertEquals(0, stats.getRunning());
        assertEquals(1, stats.getCompleted());
        assertEquals(1, stats.getFailed());
        assertEquals(List.of("total", "pending", "running", "completed", "failed"),
                     List.copyOf(stats.toMap().keySet()));
    }
    
    @Test
    void testFileUrl() throws Exception {
        Job upload = service.createUploadJob("report.pdf", new byte[] {1, 2, 3}, null);
        Job email = service.createJob(JobRequest.builder(JobType.SEND_EMAIL).parameter("recipient", "a@example.com").build());
        
        assertTrue(service.getFileUrl(upload.getId()).isEmpty());
        
        repository.update(upload.getId(), current -> current.toBuilder()
            .status(JobStatus.COMPLETED)
            .result(Map.of("file_url", "https://objects.test/job-files/report.pdf"))
            .build());
        
        assertEquals("https://objects.test/job-files/report.pdf", service.getFileUrl(upload.getId()).orElseThrow());
        assertTrue(service.getFileUrl(email.getId()).isEmpty());
    }
    
    @Test
    void testListJobTypes() {
        Map<String, String> types = service.listJobTypes();
        
        assertEquals(JobType.values().length, types.size());
        assertEquals("Send Email", types.get("send_email"));
        assertEquals("Upload File", types.get("upload_file"));
    }
    
    private Job scheduledJob(Instant runAt) throws Exception {
        return service.createJob(JobRequest.builder(JobType.GENERATE_REPORT)
            .scheduleType(ScheduleType.SCHEDULED)
            .scheduledTime(runAt)
            .build());
    }
}
