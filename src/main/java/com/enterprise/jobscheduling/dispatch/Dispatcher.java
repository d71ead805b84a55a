package com.enterprise.jobscheduling.dispatch;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.exception.InvalidScheduleException;
import com.enterprise.jobscheduling.monitoring.MetricsCollector;
import com.enterprise.jobscheduling.queue.JobQueue;
import com.enterprise.jobscheduling.schedule.FirePlan;
import com.enterprise.jobscheduling.schedule.ScheduleResolver;
import com.enterprise.jobscheduling.trigger.TaskRef;
import com.enterprise.jobscheduling.trigger.TriggerDefinition;
import com.enterprise.jobscheduling.trigger.TriggerFireListener;
import com.enterprise.jobscheduling.trigger.TriggerNames;
import com.enterprise.jobscheduling.trigger.TriggerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the triggers and queue entries of every job.
 * <p>
 * Immediate jobs are enqueued, scheduled jobs become one delayed enqueue, interval jobs get a
 * recurring trigger named {@code job-<id>} (plus a one-off {@code enable-job-<id>} activation when
 * the first run lies in the future). All mutations for one job id are serialized and always
 * delete before they create, so repeated calls never leave duplicate triggers behind.
 */
public class Dispatcher implements TriggerFireListener {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private static final int LOCK_STRIPES = 64;

    private final ScheduleResolver resolver;
    private final TriggerStore triggerStore;
    private final JobQueue queue;
    private final Clock clock;
    private final MetricsCollector metrics;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public Dispatcher(ScheduleResolver resolver, TriggerStore triggerStore, JobQueue queue,
                      Clock clock, MetricsCollector metrics) {
        this.resolver = resolver;
        this.triggerStore = triggerStore;
        this.queue = queue;
        this.clock = clock;
        this.metrics = metrics;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Arrange the executions of a newly created job
     * @return the resolved plan
     */
    public FirePlan schedule(Job job) throws InvalidScheduleException {
        FirePlan plan = resolver.resolve(job, clock.instant());
        ReentrantLock lock = lockFor(job.getId());
        lock.lock();
        try {
            apply(job.getId(), plan);
        } finally {
            lock.unlock();
        }
        return plan;
    }

    /**
     * Replace the executions of a job after its schedule changed
     */
    public FirePlan reschedule(Job job) throws InvalidScheduleException {
        FirePlan plan = resolver.resolve(job, clock.instant());
        ReentrantLock lock = lockFor(job.getId());
        lock.lock();
        try {
            cancelLocked(job.getId());
            apply(job.getId(), plan);
        } finally {
            lock.unlock();
        }
        logger.info("Rescheduled job {}: {}", job.getId(), plan);
        return plan;
    }

    /**
     * Enqueue one immediate execution, replacing any queued or delayed one. Triggers are left alone.
     */
    public void runNow(UUID jobId) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            queue.cancel(jobId);
            queue.enqueueNow(jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every trigger and pending execution of a job. Safe to call when nothing is registered.
     */
    public void cancel(Job job) {
        cancel(job.getId());
    }

    public void cancel(UUID jobId) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            cancelLocked(jobId);
        } finally {
            lock.unlock();
        }
        logger.debug("Cancelled triggers of job {}", jobId);
    }

    /**
     * Route a fired trigger. Activation triggers only enable their target; they never run a job.
     */
    @Override
    public void onFire(TriggerDefinition trigger) {
        metrics.recordTriggerFired();
        String target = trigger.getFirstArg();
        if (target == null) {
            logger.error("Trigger {} fired without a target", trigger.getName());
            return;
        }

        switch (trigger.getTaskRef()) {
            case EXECUTE_JOB:
                UUID jobId;
                try {
                    jobId = UUID.fromString(target);
                } catch (IllegalArgumentException e) {
                    logger.error("Trigger {} carries a malformed job id: {}", trigger.getName(), target);
                    return;
                }
                logger.debug("Trigger {} fired, enqueueing job {}", trigger.getName(), jobId);
                queue.enqueueNow(jobId);
                break;

            case ENABLE_TRIGGER:
                if (triggerStore.enable(target)) {
                    logger.info("Activation trigger {} enabled {}", trigger.getName(), target);
                } else {
                    logger.warn("Activation trigger {} found no trigger named {}", trigger.getName(), target);
                }
                break;

            default:
                logger.error("Trigger {} has unsupported task {}", trigger.getName(), trigger.getTaskRef());
        }
    }

    private void apply(UUID jobId, FirePlan plan) {
        switch (plan.getKind()) {
            case RUN_NOW:
                queue.enqueueNow(jobId);
                logger.debug("Job {} enqueued for immediate execution", jobId);
                break;

            case RUN_ONCE:
                queue.enqueueAt(jobId, plan.getRunAt());
                logger.debug("Job {} enqueued for {}", jobId, plan.getRunAt());
                break;

            case RECURRING:
                String jobTrigger = TriggerNames.jobTrigger(jobId);
                String activationTrigger = TriggerNames.activationTrigger(jobId);
                triggerStore.delete(jobTrigger);
                triggerStore.delete(activationTrigger);

                triggerStore.upsertRecurring(jobTrigger, plan.getRule(), plan.isEnabledAtCreation(),
                                             TaskRef.EXECUTE_JOB, List.of(jobId.toString()));
                if (!plan.isEnabledAtCreation()) {
                    triggerStore.upsertOneOff(activationTrigger, plan.getActivationTime(),
                                              TaskRef.ENABLE_TRIGGER, List.of(jobTrigger), true);
                }
                logger.debug("Job {} registered as {} (first fire {})", jobId, plan.getRule(), plan.getFirstFireTime());
                break;

            default:
                throw new IllegalStateException("Unsupported fire plan: " + plan.getKind());
        }
    }

    private void cancelLocked(UUID jobId) {
        triggerStore.delete(TriggerNames.jobTrigger(jobId));
        triggerStore.delete(TriggerNames.activationTrigger(jobId));
        queue.cancel(jobId);
    }

    private ReentrantLock lockFor(UUID jobId) {
        return locks[Math.floorMod(jobId.hashCode(), LOCK_STRIPES)];
    }
}
