package com.enterprise.jobscheduling.persistence;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.exception.OptimisticLockException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * MapDB-based job repository. Jobs are stored as JSON documents keyed by id.
 * Writes are serialized by a write lock and committed one transaction per call.
 */
public class MapDBJobRepository implements JobRepository {

    private static final Logger logger = LoggerFactory.getLogger(MapDBJobRepository.class);

    private final DB db;
    private final boolean transactional;
    private final Map<UUID, String> jobStorage;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private MapDBJobRepository(DB db, boolean transactional, Clock clock) {
        this.db = db;
        this.transactional = transactional;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.jobStorage = db.hashMap("jobs", Serializer.UUID, Serializer.STRING).createOrOpen();
    }

    /**
     * Open (or create) a file backed repository
     */
    public static MapDBJobRepository open(String dbPath, Clock clock) {
        DB db = DBMaker.fileDB(new File(dbPath))
            .fileChannelEnable()
            .transactionEnable()
            .checksumHeaderBypass()
            .closeOnJvmShutdown()
            .make();
        MapDBJobRepository repository = new MapDBJobRepository(db, true, clock);
        logger.info("MapDBJobRepository opened at {} with {} jobs", dbPath, repository.count());
        return repository;
    }

    /**
     * Create a repository held in memory only
     */
    public static MapDBJobRepository inMemory(Clock clock) {
        DB db = DBMaker.memoryDB().make();
        logger.info("MapDBJobRepository created in memory");
        return new MapDBJobRepository(db, false, clock);
    }

    @Override
    public Optional<Job> find(UUID id) {
        lock.readLock().lock();
        try {
            String json = jobStorage.get(id);
            return json == null ? Optional.empty() : Optional.of(deserialize(json));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Job save(Job job) {
        lock.writeLock().lock();
        try {
            String storedJson = jobStorage.get(job.getId());
            Instant now = clock.instant();
            Job toStore;

            if (storedJson == null) {
                if (job.getVersion() != 0) {
                    throw new OptimisticLockException(job.getId(), job.getVersion(), -1);
                }
                Instant createdAt = job.getCreatedAt() != null ? job.getCreatedAt() : now;
                toStore = job.toBuilder().createdAt(createdAt).updatedAt(now).version(1).build();
            } else {
                Job stored = deserialize(storedJson);
                if (stored.getVersion() != job.getVersion()) {
                    throw new OptimisticLockException(job.getId(), job.getVersion(), stored.getVersion());
                }
                toStore = job.toBuilder()
                    .createdAt(stored.getCreatedAt())
                    .updatedAt(now)
                    .version(stored.getVersion() + 1)
                    .build();
            }

            write(toStore);
            logger.debug("Saved job {} at version {}", toStore.getId(), toStore.getVersion());
            return toStore;

        } catch (OptimisticLockException e) {
            throw e;
        } catch (RuntimeException e) {
            rollback();
            logger.error("Failed to save job {}", job.getId(), e);
            throw new IllegalStateException("Failed to save job " + job.getId(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Job> update(UUID id, UnaryOperator<Job> mutation) {
        lock.writeLock().lock();
        try {
            String storedJson = jobStorage.get(id);
            if (storedJson == null) {
                return Optional.empty();
            }
            Job stored = deserialize(storedJson);
            Job toStore = mutation.apply(stored).toBuilder()
                .id(id)
                .createdAt(stored.getCreatedAt())
                .updatedAt(clock.instant())
                .version(stored.getVersion() + 1)
                .build();

            write(toStore);
            logger.debug("Updated job {} to status {} at version {}", id, toStore.getStatus(), toStore.getVersion());
            return Optional.of(toStore);

        } catch (RuntimeException e) {
            rollback();
            logger.error("Failed to update job {}", id, e);
            throw new IllegalStateException("Failed to update job " + id, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(UUID id) {
        lock.writeLock().lock();
        try {
            boolean removed = jobStorage.remove(id) != null;
            commit();
            if (removed) {
                logger.debug("Deleted job {}", id);
            }
            return removed;
        } catch (RuntimeException e) {
            rollback();
            logger.error("Failed to delete job {}", id, e);
            throw new IllegalStateException("Failed to delete job " + id, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Page<Job> query(JobQuery query) {
        lock.readLock().lock();
        try {
            List<Job> matching = jobStorage.values().stream()
                .map(this::deserialize)
                .filter(job -> query.getJobType() == null || job.getJobType() == query.getJobType())
                .filter(job -> query.getStatus() == null || job.getStatus() == query.getStatus())
                .sorted(Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(Job::getId))
                .collect(Collectors.toList());

            List<Job> items = matching.stream()
                .skip((long) query.getPage() * query.getPageSize())
                .limit(query.getPageSize())
                .collect(Collectors.toList());

            return new Page<>(items, query.getPage(), query.getPageSize(), matching.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        lock.readLock().lock();
        try {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobStatus status : JobStatus.values()) {
                counts.put(status, 0L);
            }
            jobStorage.values().stream()
                .map(this::deserialize)
                .forEach(job -> counts.merge(job.getStatus(), 1L, Long::sum));
            return counts;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return jobStorage.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Close the underlying database
     */
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
                logger.info("MapDBJobRepository closed");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void write(Job job) {
        try {
            jobStorage.put(job.getId(), objectMapper.writeValueAsString(job));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.getId(), e);
        }
        commit();
    }

    private Job deserialize(String json) {
        try {
            return objectMapper.readValue(json, Job.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored job", e);
        }
    }

    private void commit() {
        if (transactional) {
            db.commit();
        }
    }

    private void rollback() {
        if (transactional) {
            db.rollback();
        }
    }
}
