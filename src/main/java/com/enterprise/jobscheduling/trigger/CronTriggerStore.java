package com.enterprise.jobscheduling.trigger;

import com.enterprise.jobscheduling.schedule.RecurrenceRule;
import it.sauronsoftware.cron4j.Scheduler;
import it.sauronsoftware.cron4j.SchedulingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Trigger store backed by cron4j for recurring triggers and a scheduled executor for one-off instants.
 * <p>
 * Recurring triggers stay registered with cron4j while disabled and are skipped at fire time.
 * Enabling a recurring trigger during a minute its rule matches fires it at once, unless it
 * already fired in that minute, so an activation racing the cron tick never loses the first run.
 * One-off triggers disable themselves after firing.
 */
public class CronTriggerStore implements TriggerStore {

    private static final Logger logger = LoggerFactory.getLogger(CronTriggerStore.class);

    private final Scheduler cronScheduler;
    private final ScheduledExecutorService oneOffScheduler;
    private final TimeZone timeZone;
    private final Map<String, LiveTrigger> triggers = new ConcurrentHashMap<>();

    private volatile TriggerFireListener listener;

    public CronTriggerStore(ZoneId zone) {
        this.timeZone = TimeZone.getTimeZone(zone);
        this.cronScheduler = new Scheduler();
        this.cronScheduler.setTimeZone(timeZone);
        this.cronScheduler.setDaemon(true);

        AtomicLong threadNumber = new AtomicLong(1);
        this.oneOffScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trigger-one-off-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void upsertRecurring(String name, RecurrenceRule rule, boolean enabled,
                                TaskRef taskRef, List<String> args) {
        String pattern = rule.toCronPattern();
        if (!SchedulingPattern.validate(pattern)) {
            throw new IllegalArgumentException("Invalid cron pattern for trigger " + name + ": " + pattern);
        }

        TriggerDefinition definition = TriggerDefinition.recurring(name, rule, enabled, taskRef, args);
        triggers.compute(name, (key, existing) -> {
            if (existing != null) {
                existing.release();
            }
            LiveTrigger live = new LiveTrigger(definition);
            live.cronTaskId = cronScheduler.schedule(pattern, () -> live.fireRecurring(System.currentTimeMillis()));
            return live;
        });

        logger.info("Registered recurring trigger {} with pattern '{}' (enabled={})", name, pattern, enabled);
    }

    @Override
    public void upsertOneOff(String name, Instant instant, TaskRef taskRef, List<String> args, boolean enabled) {
        TriggerDefinition definition = TriggerDefinition.oneOff(name, instant, taskRef, args, enabled);
        triggers.compute(name, (key, existing) -> {
            if (existing != null) {
                existing.release();
            }
            LiveTrigger live = new LiveTrigger(definition);
            if (enabled) {
                live.armOneOff();
            }
            return live;
        });

        logger.info("Registered one-off trigger {} at {} (enabled={})", name, instant, enabled);
    }

    @Override
    public boolean delete(String name) {
        LiveTrigger removed = triggers.remove(name);
        if (removed == null) {
            return false;
        }
        removed.release();
        logger.info("Deleted trigger {}", name);
        return true;
    }

    @Override
    public boolean enable(String name) {
        LiveTrigger live = triggers.get(name);
        if (live == null) {
            logger.warn("Cannot enable unknown trigger {}", name);
            return false;
        }
        live.enable(System.currentTimeMillis());
        logger.info("Enabled trigger {}", name);
        return true;
    }

    @Override
    public Optional<TriggerDefinition> find(String name) {
        LiveTrigger live = triggers.get(name);
        return live == null ? Optional.empty() : Optional.of(live.definition);
    }

    @Override
    public List<TriggerDefinition> findAll() {
        return triggers.values().stream()
            .map(live -> live.definition)
            .sorted(Comparator.comparing(TriggerDefinition::getName))
            .collect(Collectors.toList());
    }

    /**
     * Set the callback that receives fired triggers
     */
    public void setFireListener(TriggerFireListener listener) {
        this.listener = listener;
    }

    /**
     * Start the cron scheduler
     */
    public void start() {
        if (!cronScheduler.isStarted()) {
            cronScheduler.start();
            logger.info("CronTriggerStore started in time zone {}", timeZone.getID());
        }
    }

    /**
     * Stop firing triggers. Registered definitions are discarded.
     */
    public void stop() {
        if (cronScheduler.isStarted()) {
            cronScheduler.stop();
        }
        oneOffScheduler.shutdownNow();
        new ArrayList<>(triggers.keySet()).forEach(name -> {
            LiveTrigger live = triggers.remove(name);
            if (live != null) {
                live.release();
            }
        });
        logger.info("CronTriggerStore stopped");
    }

    /**
     * Check if the cron scheduler is running
     */
    public boolean isRunning() {
        return cronScheduler.isStarted();
    }

    private void dispatch(TriggerDefinition definition) {
        TriggerFireListener current = listener;
        if (current == null) {
            logger.warn("Trigger {} fired with no listener attached", definition.getName());
            return;
        }
        try {
            current.onFire(definition);
        } catch (Exception e) {
            logger.error("Error handling fired trigger {}", definition.getName(), e);
        }
    }

    /**
     * Runtime state of one registered trigger
     */
    private final class LiveTrigger {
        private volatile TriggerDefinition definition;
        private String cronTaskId;
        private ScheduledFuture<?> oneOffFuture;
        private long lastFiredMinute = -1;
        private boolean released;

        LiveTrigger(TriggerDefinition definition) {
            this.definition = definition;
        }

        void fireRecurring(long nowMillis) {
            TriggerDefinition fired = claimRecurring(nowMillis);
            if (fired != null) {
                logger.debug("Recurring trigger {} fired", fired.getName());
                dispatch(fired);
            }
        }

        void fireOneOff() {
            TriggerDefinition fired;
            synchronized (this) {
                if (released || !definition.isEnabled()) {
                    return;
                }
                fired = definition;
                definition = definition.withEnabled(false);
                oneOffFuture = null;
            }
            logger.debug("One-off trigger {} fired", fired.getName());
            dispatch(fired);
        }

        void enable(long nowMillis) {
            TriggerDefinition fired = null;
            synchronized (this) {
                if (released || definition.isEnabled()) {
                    return;
                }
                definition = definition.withEnabled(true);
                if (definition.getKind() == TriggerDefinition.Kind.ONE_OFF) {
                    armOneOff();
                } else if (new SchedulingPattern(definition.getRule().toCronPattern()).match(timeZone, nowMillis)) {
                    fired = claimRecurring(nowMillis);
                }
            }
            if (fired != null) {
                logger.debug("Recurring trigger {} fired on activation", fired.getName());
                dispatch(fired);
            }
        }

        private synchronized TriggerDefinition claimRecurring(long nowMillis) {
            if (released || !definition.isEnabled()) {
                return null;
            }
            long minute = TimeUnit.MILLISECONDS.toMinutes(nowMillis);
            if (minute == lastFiredMinute) {
                return null;
            }
            lastFiredMinute = minute;
            return definition;
        }

        synchronized void armOneOff() {
            long delayMs = Math.max(0, definition.getInstant().toEpochMilli() - System.currentTimeMillis());
            oneOffFuture = oneOffScheduler.schedule(this::fireOneOff, delayMs, TimeUnit.MILLISECONDS);
        }

        synchronized void release() {
            released = true;
            if (cronTaskId != null) {
                cronScheduler.deschedule(cronTaskId);
                cronTaskId = null;
            }
            if (oneOffFuture != null) {
                oneOffFuture.cancel(false);
                oneOffFuture = null;
            }
        }
    }
}
