package com.enterprise.jobscheduling.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToIntFunction;

/**
 * In-process job queue backed by a fixed worker pool.
 * <p>
 * Ready executions wait in a priority queue (higher job priority first, FIFO among equals).
 * Delayed executions are held by a scheduler and move to the ready queue when due; at most one
 * delayed execution is held per job id, a newer one replaces the older.
 * <p>
 * The capacity bound applies to new immediate enqueues only. A delayed execution that comes due
 * is always admitted, so a scheduled start or a backoff retry is never lost to a full queue.
 */
public class WorkerJobQueue implements JobQueue {

    private static final Logger logger = LoggerFactory.getLogger(WorkerJobQueue.class);

    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService delayer;
    private final ToIntFunction<UUID> priorityLookup;
    private final int queueCapacity;
    private final Duration shutdownTimeout;
    private final Map<UUID, DelayedRun> delayedRuns = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicInteger waiting = new AtomicInteger(0);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong totalEnqueued = new AtomicLong(0);
    private final AtomicLong totalStarted = new AtomicLong(0);

    private volatile JobRunner runner;

    /**
     * @param poolSize number of worker threads
     * @param queueCapacity maximum number of ready executions waiting for a worker when a new
     *                      immediate execution is admitted
     * @param shutdownTimeout how long shutdown waits for running executions
     * @param priorityLookup resolves the priority of a job id at enqueue time
     */
    public WorkerJobQueue(int poolSize, int queueCapacity, Duration shutdownTimeout,
                          ToIntFunction<UUID> priorityLookup) {
        this.queueCapacity = queueCapacity;
        this.shutdownTimeout = shutdownTimeout;
        this.priorityLookup = priorityLookup;

        // Fixed size: a ThreadPoolExecutor never grows past core size on an unbounded queue
        this.workers = new ThreadPoolExecutor(
            poolSize,
            poolSize,
            0L,
            TimeUnit.MILLISECONDS,
            new PriorityBlockingQueue<>(),
            new WorkerThreadFactory("job-worker-"),
            new QueueRejectedExecutionHandler()
        );
        this.delayer = Executors.newSingleThreadScheduledExecutor(new WorkerThreadFactory("job-delay-"));

        logger.info("WorkerJobQueue initialized with {} workers, capacity {}", poolSize, queueCapacity);
    }

    /**
     * Start handing queued executions to the runner
     */
    public void start(JobRunner runner) {
        this.runner = runner;
        if (running.compareAndSet(false, true)) {
            logger.info("WorkerJobQueue started");
        }
    }

    @Override
    public void enqueueNow(UUID jobId) {
        ensureRunning();
        reserveSlot();
        submit(jobId);
    }

    private void reserveSlot() {
        while (true) {
            int current = waiting.get();
            if (current >= queueCapacity) {
                throw new RejectedExecutionException("Job queue is full (" + current + " waiting)");
            }
            if (waiting.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }

    // Caller has already counted the execution in waiting
    private void submit(UUID jobId) {
        int priority = priorityLookup.applyAsInt(jobId);
        try {
            workers.execute(new QueuedRun(jobId, priority, sequence.getAndIncrement()));
        } catch (RejectedExecutionException e) {
            waiting.decrementAndGet();
            throw e;
        }
        totalEnqueued.incrementAndGet();
        logger.debug("Job {} enqueued with priority {}", jobId, priority);
    }

    @Override
    public void enqueueAt(UUID jobId, Instant instant) {
        Duration delay = Duration.between(Instant.now(), instant);
        enqueueAfter(jobId, delay.isNegative() ? Duration.ZERO : delay);
    }

    @Override
    public void enqueueAfter(UUID jobId, Duration delay) {
        ensureRunning();
        DelayedRun delayedRun = new DelayedRun(jobId);
        DelayedRun previous = delayedRuns.put(jobId, delayedRun);
        if (previous != null) {
            previous.cancel();
            logger.debug("Replaced delayed execution of job {}", jobId);
        }
        delayedRun.future = delayer.schedule(delayedRun, delay.toMillis(), TimeUnit.MILLISECONDS);
        logger.debug("Job {} enqueued to start in {}ms", jobId, delay.toMillis());
    }

    @Override
    public boolean cancel(UUID jobId) {
        boolean cancelled = false;

        DelayedRun delayedRun = delayedRuns.remove(jobId);
        if (delayedRun != null) {
            delayedRun.cancel();
            cancelled = true;
        }

        for (Runnable queued : workers.getQueue()) {
            if (queued instanceof QueuedRun && ((QueuedRun) queued).jobId.equals(jobId)
                && workers.getQueue().remove(queued)) {
                waiting.decrementAndGet();
                cancelled = true;
            }
        }

        if (cancelled) {
            logger.debug("Cancelled pending executions of job {}", jobId);
        }
        return cancelled;
    }

    /**
     * Whether a delayed execution of the job is waiting
     */
    public boolean hasDelayedRun(UUID jobId) {
        return delayedRuns.containsKey(jobId);
    }

    /** Ready executions waiting for a worker */
    public int getQueueSize() {
        return workers.getQueue().size();
    }

    public int getDelayedCount() {
        return delayedRuns.size();
    }

    public int getActiveCount() {
        return workers.getActiveCount();
    }

    public long getTotalEnqueued() {
        return totalEnqueued.get();
    }

    public long getTotalStarted() {
        return totalStarted.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stop accepting executions and wait for running ones to finish
     */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            workers.shutdownNow();
            delayer.shutdownNow();
            return;
        }
        logger.info("Shutting down WorkerJobQueue...");

        delayer.shutdownNow();
        delayedRuns.clear();
        workers.shutdown();

        try {
            if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Workers did not terminate gracefully, forcing shutdown");
                workers.shutdownNow();
            }
            logger.info("WorkerJobQueue shutdown completed");
        } catch (InterruptedException e) {
            logger.error("Interrupted during shutdown", e);
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("WorkerJobQueue is not running");
        }
    }

    /**
     * Ready execution ordered by priority, then by enqueue order
     */
    private final class QueuedRun implements Runnable, Comparable<QueuedRun> {
        private final UUID jobId;
        private final int priority;
        private final long seq;

        QueuedRun(UUID jobId, int priority, long seq) {
            this.jobId = jobId;
            this.priority = priority;
            this.seq = seq;
        }

        @Override
        public void run() {
            waiting.decrementAndGet();
            totalStarted.incrementAndGet();
            try {
                runner.run(jobId);
            } catch (Exception e) {
                logger.error("Unhandled error executing job {}", jobId, e);
            }
        }

        @Override
        public int compareTo(QueuedRun other) {
            int byPriority = Integer.compare(other.priority, priority);
            return byPriority != 0 ? byPriority : Long.compare(seq, other.seq);
        }
    }

    /**
     * Execution waiting for its start time
     */
    private final class DelayedRun implements Runnable {
        private final UUID jobId;
        private volatile ScheduledFuture<?> future;

        DelayedRun(UUID jobId) {
            this.jobId = jobId;
        }

        @Override
        public void run() {
            if (!delayedRuns.remove(jobId, this)) {
                return;
            }
            if (!running.get()) {
                return;
            }
            waiting.incrementAndGet();
            try {
                submit(jobId);
            } catch (RuntimeException e) {
                logger.error("Failed to enqueue delayed execution of job {}", jobId, e);
            }
        }

        void cancel() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }

    /**
     * Named non-daemon worker threads
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix;

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }

    /**
     * Rejects executions submitted after shutdown
     */
    private static class QueueRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            logger.error("Job execution rejected - worker pool is shut down");
            throw new RejectedExecutionException("Job execution rejected - worker pool is shut down");
        }
    }
}
