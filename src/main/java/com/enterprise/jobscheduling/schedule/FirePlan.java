package com.enterprise.jobscheduling.schedule;

import java.time.Instant;

/**
 * Resolved decision of when and how often a job runs
 */
public final class FirePlan {

    public enum Kind {
        RUN_NOW,
        RUN_ONCE,
        RECURRING
    }

    private final Kind kind;
    private final Instant runAt;
    private final RecurrenceRule rule;
    private final boolean enabledAtCreation;
    private final Instant activationTime;
    private final Instant firstFireTime;

    private FirePlan(Kind kind, Instant runAt, RecurrenceRule rule, boolean enabledAtCreation,
                     Instant activationTime, Instant firstFireTime) {
        this.kind = kind;
        this.runAt = runAt;
        this.rule = rule;
        this.enabledAtCreation = enabledAtCreation;
        this.activationTime = activationTime;
        this.firstFireTime = firstFireTime;
    }

    public static FirePlan runNow(Instant now) {
        return new FirePlan(Kind.RUN_NOW, null, null, true, null, now);
    }

    public static FirePlan runOnceAt(Instant runAt) {
        return new FirePlan(Kind.RUN_ONCE, runAt, null, true, null, runAt);
    }

    /**
     * Recurring plan that starts enabled
     */
    public static FirePlan recurring(RecurrenceRule rule, Instant firstFireTime) {
        return new FirePlan(Kind.RECURRING, null, rule, true, null, firstFireTime);
    }

    /**
     * Recurring plan that stays disabled until the activation instant
     */
    public static FirePlan recurringFrom(RecurrenceRule rule, Instant activationTime) {
        return new FirePlan(Kind.RECURRING, null, rule, false, activationTime, activationTime);
    }

    public Kind getKind() { return kind; }

    /**
     * Instant of the single execution of a {@link Kind#RUN_ONCE} plan
     */
    public Instant getRunAt() { return runAt; }

    public RecurrenceRule getRule() { return rule; }

    public boolean isEnabledAtCreation() { return enabledAtCreation; }

    /**
     * Instant at which a disabled recurring trigger gets enabled, null when enabled at creation
     */
    public Instant getActivationTime() { return activationTime; }

    public Instant getFirstFireTime() { return firstFireTime; }

    public boolean isRecurring() {
        return kind == Kind.RECURRING;
    }

    @Override
    public String toString() {
        switch (kind) {
            case RUN_NOW:
                return "FirePlan[run now]";
            case RUN_ONCE:
                return "FirePlan[run once at " + runAt + "]";
            default:
                return "FirePlan[recurring " + rule + ", enabled=" + enabledAtCreation
                    + ", first=" + firstFireTime + "]";
        }
    }
}
