package com.enterprise.jobscheduling;

import com.enterprise.jobscheduling.config.ConfigValidator;
import com.enterprise.jobscheduling.config.JobSystemConfig;
import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.dispatch.Dispatcher;
import com.enterprise.jobscheduling.executor.JobExecutor;
import com.enterprise.jobscheduling.executor.RetryPolicy;
import com.enterprise.jobscheduling.handler.HandlerRegistry;
import com.enterprise.jobscheduling.integration.FileSystemObjectStore;
import com.enterprise.jobscheduling.integration.LoggingMailer;
import com.enterprise.jobscheduling.integration.Mailer;
import com.enterprise.jobscheduling.integration.ObjectStore;
import com.enterprise.jobscheduling.monitoring.MetricsCollector;
import com.enterprise.jobscheduling.notify.EventBusNotifier;
import com.enterprise.jobscheduling.persistence.MapDBJobRepository;
import com.enterprise.jobscheduling.queue.WorkerJobQueue;
import com.enterprise.jobscheduling.schedule.ScheduleResolver;
import com.enterprise.jobscheduling.service.JobRequestValidator;
import com.enterprise.jobscheduling.service.JobService;
import com.enterprise.jobscheduling.trigger.CronTriggerStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Factory for creating and wiring a job system
 */
public class JobSystemFactory {

    private static final Logger logger = LoggerFactory.getLogger(JobSystemFactory.class);

    /**
     * Create a job system from {@code job-system.properties}, or defaults when absent
     */
    public static JobSystem createDefault() {
        return create(JobSystemConfig.load());
    }

    /**
     * Create a job system that logs mail and stores uploads on the local file system
     */
    public static JobSystem create(JobSystemConfig config) {
        return create(config, null, null, Clock.systemUTC());
    }

    /**
     * Create a job system with custom external capabilities
     * @param mailer mail transport, null for a {@link LoggingMailer}
     * @param objectStore upload destination, null for a {@link FileSystemObjectStore} under the configured root
     */
    public static JobSystem create(JobSystemConfig config, Mailer mailer, ObjectStore objectStore, Clock clock) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }

        JobSystemConfig.UploadConfig upload = config.getUploadConfig();
        JobSystemConfig.HandlerConfig handlerConfig = config.getHandlerConfig();
        if (mailer == null) {
            mailer = new LoggingMailer(handlerConfig.getMailFrom());
        }
        if (objectStore == null) {
            objectStore = new FileSystemObjectStore(Paths.get(upload.getStorageRoot()), upload.getPublicBaseUrl());
        }

        MetricsCollector metrics = new MetricsCollector(createMeterRegistry(config.getMonitoringConfig()));
        MapDBJobRepository repository = createRepository(config.getStorageConfig(), clock);

        try {
            JobSystemConfig.ExecutorConfig executorConfig = config.getExecutorConfig();
            WorkerJobQueue queue = new WorkerJobQueue(
                executorConfig.getPoolSize(),
                executorConfig.getQueueCapacity(),
                executorConfig.getShutdownTimeout(),
                jobId -> repository.find(jobId).map(Job::getPriority).orElse(Job.DEFAULT_PRIORITY));

            CronTriggerStore triggerStore = new CronTriggerStore(config.getSchedulerConfig().getZone());
            ScheduleResolver resolver = new ScheduleResolver(config.getSchedulerConfig().getZone());
            Dispatcher dispatcher = new Dispatcher(resolver, triggerStore, queue, clock, metrics);
            triggerStore.setFireListener(dispatcher);

            EventBusNotifier notifier = new EventBusNotifier();
            HandlerRegistry handlers = HandlerRegistry.standard(mailer, objectStore, upload.getBucket(),
                                                                handlerConfig.getSimulatedDuration());
            JobExecutor executor = new JobExecutor(repository, handlers, queue, notifier,
                                                   createRetryPolicy(config.getRetryConfig()), metrics);

            JobService jobService = new JobService(repository, dispatcher, notifier,
                                                   new JobRequestValidator(upload.getMaxUploadBytes()),
                                                   metrics, clock, Paths.get(upload.getTempDir()));

            logger.info("JobSystem created with {} workers in zone {}", executorConfig.getPoolSize(),
                       config.getSchedulerConfig().getZone());
            return new JobSystem(config, repository, queue, triggerStore, notifier, dispatcher,
                                 executor, jobService, metrics);

        } catch (RuntimeException e) {
            logger.error("Failed to create JobSystem", e);
            repository.close();
            throw new RuntimeException("Failed to create JobSystem", e);
        }
    }

    private static MeterRegistry createMeterRegistry(JobSystemConfig.MonitoringConfig config) {
        // A composite without children discards every measurement
        return config.isEnableMetrics() ? new SimpleMeterRegistry() : new CompositeMeterRegistry();
    }

    private static MapDBJobRepository createRepository(JobSystemConfig.StorageConfig config, Clock clock) {
        if (config.isInMemory()) {
            return MapDBJobRepository.inMemory(clock);
        }
        return MapDBJobRepository.open(config.getDbPath(), clock);
    }

    private static RetryPolicy createRetryPolicy(JobSystemConfig.RetryConfig config) {
        return RetryPolicy.builder()
            .baseDelay(config.getBaseDelay())
            .backoffMultiplier(config.getBackoffMultiplier())
            .maxDelay(config.getMaxDelay())
            .build();
    }
}
