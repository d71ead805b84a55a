package com.enterprise.jobscheduling.notify;

/**
 * Publishes job status changes to observers.
 * Publishing is fire-and-forget: implementations must not block the caller on delivery
 * and must not throw because an observer failed.
 */
public interface JobStatusNotifier {
    
    /** Shared topic every job status change is published on */
    String JOB_STATUS_TOPIC = "job_status";
    
    void publish(String topic, JobStatusEvent event);
    
    default void publish(JobStatusEvent event) {
        publish(JOB_STATUS_TOPIC, event);
    }
}
