package com.enterprise.jobscheduling.handler;

import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.exception.HandlerNotFoundException;
import com.enterprise.jobscheduling.integration.Mailer;
import com.enterprise.jobscheduling.integration.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup table from job type to handler
 */
public class HandlerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    /**
     * Registry with a handler for every job type: mail and upload handlers for their types,
     * the simulated generic handler for the rest
     */
    public static HandlerRegistry standard(Mailer mailer, ObjectStore objectStore, String bucket,
                                           Duration simulatedDuration) {
        HandlerRegistry registry = new HandlerRegistry();
        JobHandler generic = new GenericJobHandler(simulatedDuration);
        for (JobType type : JobType.values()) {
            registry.register(type, generic);
        }
        registry.register(JobType.SEND_EMAIL, new SendEmailHandler(mailer));
        registry.register(JobType.UPLOAD_FILE, new UploadFileHandler(objectStore, bucket));
        return registry;
    }

    public synchronized HandlerRegistry register(JobType jobType, JobHandler handler) {
        handlers.put(jobType, handler);
        logger.debug("Registered {} for job type {}", handler.getClass().getSimpleName(), jobType);
        return this;
    }

    public synchronized JobHandler handlerFor(JobType jobType) throws HandlerNotFoundException {
        JobHandler handler = handlers.get(jobType);
        if (handler == null) {
            throw new HandlerNotFoundException(jobType);
        }
        return handler;
    }

    public synchronized boolean hasHandler(JobType jobType) {
        return handlers.containsKey(jobType);
    }
}
