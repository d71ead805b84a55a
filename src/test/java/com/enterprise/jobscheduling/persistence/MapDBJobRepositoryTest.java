package com.enterprise.jobscheduling.persistence;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.core.ScheduleType;
import com.enterprise.jobscheduling.exception.JobNotFoundException;
import com.enterprise.jobscheduling.exception.OptimisticLockException;
import com.enterprise.jobscheduling.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

class MapDBJobRepositoryTest {
    
    @TempDir
    Path tempDir;
    
    private MutableClock clock;
    private MapDBJobRepository repository;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2030-01-01T00:00:00Z"));
        repository = MapDBJobRepository.open(tempDir.resolve("jobs.db").toString(), clock);
    }
    
    @AfterEach
    void tearDown() {
        repository.close();
    }
    
    @Test
    void testSaveAssignsVersionAndTimestamps() {
        Job saved = repository.save(Job.builder().jobType(JobType.FETCH_DATA).build());
        
        assertEquals(1, saved.getVersion());
        assertEquals(clock.instant(), saved.getCreatedAt());
        assertEquals(clock.instant(), saved.getUpdatedAt());
        assertEquals(saved, repository.find(saved.getId()).orElseThrow());
    }
    
    @Test
    void testStaleSaveIsRejected() {
        Job saved = repository.save(Job.builder().jobType(JobType.FETCH_DATA).build());
        clock.advance(Duration.ofMinutes(1));
        Job updated = repository.save(saved.withStatus(JobStatus.RUNNING));
        
        assertEquals(2, updated.getVersion());
        assertEquals(saved.getCreatedAt(), updated.getCreatedAt());
        assertEquals(clock.instant(), updated.getUpdatedAt());
        
        OptimisticLockException e = assertThrows(OptimisticLockException.class,
            () -> repository.save(saved.withStatus(JobStatus.FAILED)));
        assertEquals(1, e.getExpectedVersion());
        assertEquals(2, e.getActualVersion());
        assertEquals(JobStatus.RUNNING, repository.find(saved.getId()).orElseThrow().getStatus());
    }
    
    @Test
    void testUpdateAppliesMutationAtomically() throws Exception {
        Job saved = repository.save(Job.builder().jobType(JobType.FETCH_DATA).build());
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        
        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    repository.update(saved.getId(), job -> job.withRetries(job.getRetries() + 1));
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        
        Job result = repository.load(saved.getId());
        assertEquals(threads * perThread, result.getRetries());
        assertEquals(1 + threads * perThread, result.getVersion());
    }
    
    @Test
    void testUpdateOfMissingJob() {
        assertTrue(repository.update(UUID.randomUUID(), job -> job.withStatus(JobStatus.RUNNING)).isEmpty());
    }
    
    @Test
    void testLoadMissingJob() {
        UUID id = UUID.randomUUID();
        
        JobNotFoundException e = assertThrows(JobNotFoundException.class, () -> repository.load(id));
        assertEquals(id, e.getJobId());
    }
    
    @Test
    void testDelete() {
        Job saved = repository.save(Job.builder().jobType(JobType.FETCH_DATA).build());
        
        assertTrue(repository.delete(saved.getId()));
        assertFalse(repository.delete(saved.getId()));
        assertEquals(0, repository.count());
    }
    
    @Test
    void testQueryFiltersSortsAndPages() {
        List<Job> emails = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            emails.add(repository.save(Job.builder()
                .jobType(JobType.SEND_EMAIL)
                .parameters(Map.of("recipient", "user" + i + "@example.com"))
                .build()));
        }
        clock.advance(Duration.ofSeconds(1));
        Job report = repository.save(Job.builder().jobType(JobType.GENERATE_REPORT).build());
        repository.update(report.getId(), job -> job.withStatus(JobStatus.FAILED));
        
        Page<Job> firstPage = repository.query(JobQuery.builder().jobType(JobType.SEND_EMAIL).pageSize(2).build());
        Page<Job> lastPage = repository.query(JobQuery.builder().jobType(JobType.SEND_EMAIL).page(2).pageSize(2).build());
        Page<Job> failed = repository.query(JobQuery.builder().status(JobStatus.FAILED).build());
        
        assertEquals(5, firstPage.getTotalItems());
        assertEquals(3, firstPage.getTotalPages());
        assertTrue(firstPage.hasNext());
        assertEquals(emails.get(4).getId(), firstPage.getItems().get(0).getId());
        assertEquals(emails.get(3).getId(), firstPage.getItems().get(1).getId());
        assertEquals(1, lastPage.getItems().size());
        assertEquals(emails.get(0).getId(), lastPage.getItems().get(0).getId());
        assertFalse(lastPage.hasNext());
        assertEquals(1, failed.getTotalItems());
        assertEquals(report.getId(), failed.getItems().get(0).getId());
    }
    
    @Test
    void testCountByStatusIncludesZeroes() {
        Job a = repository.save(Job.builder().jobType(JobType.FETCH_DATA).build());
        repository.save(Job.builder().jobType(JobType.FETCH_DATA).build());
        repository.update(a.getId(), job -> job.withStatus(JobStatus.COMPLETED));
        
        Map<JobStatus, Long> counts = repository.countByStatus();
        
        assertEquals(1L, counts.get(JobStatus.PENDING));
        assertEquals(1L, counts.get(JobStatus.COMPLETED));
        assertEquals(0L, counts.get(JobStatus.RUNNING));
        assertEquals(0L, counts.get(JobStatus.FAILED));
    }
    
    @Test
    void testJobsSurviveReopen() {
        Instant start = Instant.parse("2030-02-01T09:00:00Z");
        Job saved = repository.save(Job.builder()
            .jobType(JobType.BACKUP_DATABASE)
            .scheduleType(ScheduleType.INTERVAL)
            .scheduledTime(start)
            .frequency(Frequency.MONTHLY)
            .result(Map.of("message", "done"))
            .build());
        repository.close();
        
        repository = MapDBJobRepository.open(tempDir.resolve("jobs.db").toString(), clock);
        Job reloaded = repository.find(saved.getId()).orElseThrow();
        
        assertEquals(ScheduleType.INTERVAL, reloaded.getScheduleType());
        assertEquals(start, reloaded.getScheduledTime());
        assertEquals(Frequency.MONTHLY, reloaded.getFrequency());
        assertEquals("done", reloaded.getResult().get("message"));
        assertEquals(1, reloaded.getVersion());
    }
    
    @Test
    void testInMemoryRepository() {
        MapDBJobRepository memory = MapDBJobRepository.inMemory(clock);
        try {
            Job saved = memory.save(Job.builder().jobType(JobType.CLEANUP_FILES).build());
            assertEquals(1, memory.count());
            assertTrue(memory.find(saved.getId()).isPresent());
        } finally {
            memory.close();
        }
    }
}
