package com.enterprise.jobscheduling;

import com.enterprise.jobscheduling.config.JobSystemConfig;
import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.core.ScheduleType;
import com.enterprise.jobscheduling.dispatch.Dispatcher;
import com.enterprise.jobscheduling.exception.InvalidScheduleException;
import com.enterprise.jobscheduling.executor.JobExecutor;
import com.enterprise.jobscheduling.monitoring.MetricsCollector;
import com.enterprise.jobscheduling.notify.EventBusNotifier;
import com.enterprise.jobscheduling.persistence.JobQuery;
import com.enterprise.jobscheduling.persistence.MapDBJobRepository;
import com.enterprise.jobscheduling.persistence.Page;
import com.enterprise.jobscheduling.queue.WorkerJobQueue;
import com.enterprise.jobscheduling.service.JobService;
import com.enterprise.jobscheduling.trigger.CronTriggerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A wired job system: store, queue, triggers, executor and the job-facing service
 */
public class JobSystem {

    private static final Logger logger = LoggerFactory.getLogger(JobSystem.class);

    private final JobSystemConfig config;
    private final MapDBJobRepository repository;
    private final WorkerJobQueue queue;
    private final CronTriggerStore triggerStore;
    private final EventBusNotifier notifier;
    private final Dispatcher dispatcher;
    private final JobExecutor executor;
    private final JobService jobService;
    private final MetricsCollector metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public JobSystem(JobSystemConfig config, MapDBJobRepository repository, WorkerJobQueue queue,
                     CronTriggerStore triggerStore, EventBusNotifier notifier, Dispatcher dispatcher,
                     JobExecutor executor, JobService jobService, MetricsCollector metrics) {
        this.config = config;
        this.repository = repository;
        this.queue = queue;
        this.triggerStore = triggerStore;
        this.notifier = notifier;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.jobService = jobService;
        this.metrics = metrics;
    }

    public JobSystemConfig getConfig() { return config; }
    public JobService getJobService() { return jobService; }
    public EventBusNotifier getNotifier() { return notifier; }
    public MapDBJobRepository getRepository() { return repository; }
    public WorkerJobQueue getQueue() { return queue; }
    public CronTriggerStore getTriggerStore() { return triggerStore; }
    public Dispatcher getDispatcher() { return dispatcher; }

    /**
     * Start workers and triggers, then re-arm the jobs found in the store
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        queue.start(executor);
        triggerStore.start();
        int recovered = recoverJobs();
        logger.info("JobSystem started, {} stored jobs re-armed", recovered);
    }

    /**
     * Stop triggers first so nothing new is enqueued, then drain the workers
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping JobSystem...");
        triggerStore.stop();
        queue.shutdown();
        notifier.shutdown();
        repository.close();
        logger.info("JobSystem stopped");
    }

    public boolean isRunning() {
        return running.get() && queue.isRunning() && triggerStore.isRunning();
    }

    /**
     * Metrics snapshot with current queue gauges
     */
    public Map<String, Object> getMetrics() {
        metrics.updateQueueSize(queue.getQueueSize(), queue.getDelayedCount());
        return metrics.getMetrics();
    }

    /**
     * Triggers and delayed executions only live in memory. After a restart, interval jobs get their
     * triggers back and pending one-shot jobs are enqueued again; a scheduled job whose time passed
     * while the system was down runs at once.
     */
    private int recoverJobs() {
        int recovered = 0;
        int pageIndex = 0;
        Page<Job> page;
        do {
            page = repository.query(JobQuery.builder().page(pageIndex++).pageSize(JobQuery.MAX_PAGE_SIZE).build());
            for (Job job : page.getItems()) {
                boolean recurring = job.getScheduleType() == ScheduleType.INTERVAL;
                if (!recurring && job.getStatus() != JobStatus.PENDING) {
                    continue;
                }
                try {
                    dispatcher.schedule(job);
                    recovered++;
                } catch (InvalidScheduleException | RuntimeException e) {
                    logger.error("Could not re-arm job {}", job.getId(), e);
                }
            }
        } while (page.hasNext());
        return recovered;
    }
}
