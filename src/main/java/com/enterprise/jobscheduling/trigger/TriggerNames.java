package com.enterprise.jobscheduling.trigger;

import java.util.UUID;

/**
 * Deterministic trigger names derived from a job id
 */
public final class TriggerNames {
    
    private static final String JOB_PREFIX = "job-";
    private static final String ENABLE_PREFIX = "enable-job-";
    
    private TriggerNames() {
    }
    
    /** Name of the recurring trigger that executes the job */
    public static String jobTrigger(UUID jobId) {
        return JOB_PREFIX + jobId;
    }
    
    /** Name of the one-off trigger that enables the recurring trigger */
    public static String activationTrigger(UUID jobId) {
        return ENABLE_PREFIX + jobId;
    }
}
