package com.enterprise.jobscheduling.schedule;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.ScheduleType;
import com.enterprise.jobscheduling.exception.InvalidScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Converts a job's schedule intent into a {@link FirePlan}.
 * Resolution is a pure function of its inputs; "now" is always passed in.
 */
public class ScheduleResolver {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleResolver.class);

    private final ZoneId zone;

    /**
     * @param zone time zone in which recurrence fields (hour, day, month) are interpreted
     */
    public ScheduleResolver(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId getZone() {
        return zone;
    }

    public FirePlan resolve(Job job, Instant now) throws InvalidScheduleException {
        return resolve(job.getScheduleType(), job.getScheduledTime(), job.getFrequency(), now);
    }

    public FirePlan resolve(ScheduleType scheduleType, Instant scheduledTime, Frequency frequency,
                            Instant now) throws InvalidScheduleException {
        if (scheduleType == null) {
            throw new InvalidScheduleException("schedule_type", "Schedule type is required");
        }

        switch (scheduleType) {
            case IMMEDIATE:
                return FirePlan.runNow(now);

            case SCHEDULED:
                if (scheduledTime == null) {
                    throw new InvalidScheduleException("scheduled_time",
                        "Scheduled time is required for scheduled jobs");
                }
                return FirePlan.runOnceAt(scheduledTime);

            case INTERVAL:
                return resolveRecurring(scheduledTime, frequency, now);

            default:
                throw new InvalidScheduleException("schedule_type", "Unsupported schedule type: " + scheduleType);
        }
    }

    private FirePlan resolveRecurring(Instant scheduledTime, Frequency frequency, Instant now)
            throws InvalidScheduleException {
        if (frequency == null) {
            throw new InvalidScheduleException("frequency", "Frequency is required for interval jobs");
        }

        Instant reference = scheduledTime != null ? scheduledTime : now;
        RecurrenceRule rule = RecurrenceRule.of(frequency, reference.atZone(zone));

        FirePlan plan;
        if (reference.isAfter(now)) {
            plan = FirePlan.recurringFrom(rule, reference);
        } else {
            plan = FirePlan.recurring(rule, rule.nextFireTime(now, zone));
        }

        logger.debug("Resolved {} schedule from reference {} to {}", frequency, reference, plan);
        return plan;
    }
}
