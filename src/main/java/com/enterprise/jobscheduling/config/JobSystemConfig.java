package com.enterprise.jobscheduling.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import java.util.UUID;

/**
 * Configuration for the job scheduling system
 */
public class JobSystemConfig {

    private static final Logger logger = LoggerFactory.getLogger(JobSystemConfig.class);

    /** Classpath resource read by {@link #load()} */
    public static final String DEFAULT_RESOURCE = "job-system.properties";

    private final ExecutorConfig executorConfig;
    private final StorageConfig storageConfig;
    private final RetryConfig retryConfig;
    private final SchedulerConfig schedulerConfig;
    private final UploadConfig uploadConfig;
    private final HandlerConfig handlerConfig;
    private final MonitoringConfig monitoringConfig;

    public JobSystemConfig(ExecutorConfig executorConfig, StorageConfig storageConfig,
                           RetryConfig retryConfig, SchedulerConfig schedulerConfig,
                           UploadConfig uploadConfig, HandlerConfig handlerConfig,
                           MonitoringConfig monitoringConfig) {
        this.executorConfig = executorConfig;
        this.storageConfig = storageConfig;
        this.retryConfig = retryConfig;
        this.schedulerConfig = schedulerConfig;
        this.uploadConfig = uploadConfig;
        this.handlerConfig = handlerConfig;
        this.monitoringConfig = monitoringConfig;
    }

    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    public StorageConfig getStorageConfig() { return storageConfig; }
    public RetryConfig getRetryConfig() { return retryConfig; }
    public SchedulerConfig getSchedulerConfig() { return schedulerConfig; }
    public UploadConfig getUploadConfig() { return uploadConfig; }
    public HandlerConfig getHandlerConfig() { return handlerConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }

    /**
     * Worker pool configuration
     */
    public static class ExecutorConfig {
        private final int poolSize;
        private final int queueCapacity;
        private final Duration shutdownTimeout;

        public ExecutorConfig(int poolSize, int queueCapacity, Duration shutdownTimeout) {
            this.poolSize = poolSize;
            this.queueCapacity = queueCapacity;
            this.shutdownTimeout = shutdownTimeout;
        }

        public int getPoolSize() { return poolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
    }

    /**
     * Job store configuration. An in-memory store ignores the path.
     */
    public static class StorageConfig {
        private final String dbPath;
        private final boolean inMemory;

        public StorageConfig(String dbPath, boolean inMemory) {
            this.dbPath = dbPath;
            this.inMemory = inMemory;
        }

        public String getDbPath() { return dbPath; }
        public boolean isInMemory() { return inMemory; }
    }

    /**
     * Backoff configuration. The retry ceiling is read from each job.
     */
    public static class RetryConfig {
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;

        public RetryConfig(Duration baseDelay, double backoffMultiplier, Duration maxDelay) {
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
        }

        public Duration getBaseDelay() { return baseDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public Duration getMaxDelay() { return maxDelay; }
    }

    /**
     * Time zone recurrence rules are evaluated in
     */
    public static class SchedulerConfig {
        private final ZoneId zone;

        public SchedulerConfig(ZoneId zone) {
            this.zone = zone;
        }

        public ZoneId getZone() { return zone; }
    }

    /**
     * File upload configuration
     */
    public static class UploadConfig {
        private final String tempDir;
        private final long maxUploadBytes;
        private final String storageRoot;
        private final String bucket;
        private final String publicBaseUrl;

        public UploadConfig(String tempDir, long maxUploadBytes, String storageRoot,
                            String bucket, String publicBaseUrl) {
            this.tempDir = tempDir;
            this.maxUploadBytes = maxUploadBytes;
            this.storageRoot = storageRoot;
            this.bucket = bucket;
            this.publicBaseUrl = publicBaseUrl;
        }

        /** Directory uploads wait in until their job runs */
        public String getTempDir() { return tempDir; }
        public long getMaxUploadBytes() { return maxUploadBytes; }
        public String getStorageRoot() { return storageRoot; }
        public String getBucket() { return bucket; }
        public String getPublicBaseUrl() { return publicBaseUrl; }
    }

    /**
     * Handler configuration
     */
    public static class HandlerConfig {
        private final Duration simulatedDuration;
        private final String mailFrom;

        public HandlerConfig(Duration simulatedDuration, String mailFrom) {
            this.simulatedDuration = simulatedDuration;
            this.mailFrom = mailFrom;
        }

        /** How long the generic handler pretends to work */
        public Duration getSimulatedDuration() { return simulatedDuration; }
        public String getMailFrom() { return mailFrom; }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;

        public MonitoringConfig(boolean enableMetrics) {
            this.enableMetrics = enableMetrics;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
    }

    /**
     * Load configuration from {@value #DEFAULT_RESOURCE} on the classpath, falling back to defaults
     */
    public static JobSystemConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static JobSystemConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = JobSystemConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("No {} on the classpath, using default configuration", resource);
                return builder().build();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration resource " + resource, e);
        }
        logger.info("Loaded configuration from {}", resource);
        return fromProperties(properties);
    }

    /**
     * Build a configuration from properties. Absent keys keep their defaults; durations use the
     * ISO-8601 form ({@code PT30S}).
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static JobSystemConfig fromProperties(Properties properties) {
        ExecutorConfig executor = Defaults.defaultExecutorConfig();
        StorageConfig storage = Defaults.defaultStorageConfig();
        RetryConfig retry = Defaults.defaultRetryConfig();
        SchedulerConfig scheduler = Defaults.defaultSchedulerConfig();
        UploadConfig upload = Defaults.defaultUploadConfig();
        HandlerConfig handler = Defaults.defaultHandlerConfig();
        MonitoringConfig monitoring = Defaults.defaultMonitoringConfig();

        return builder()
            .executorConfig(new ExecutorConfig(
                intValue(properties, "executor.poolSize", executor.getPoolSize()),
                intValue(properties, "executor.queueCapacity", executor.getQueueCapacity()),
                durationValue(properties, "executor.shutdownTimeout", executor.getShutdownTimeout())))
            .storageConfig(new StorageConfig(
                stringValue(properties, "storage.dbPath", storage.getDbPath()),
                booleanValue(properties, "storage.inMemory", storage.isInMemory())))
            .retryConfig(new RetryConfig(
                durationValue(properties, "retry.baseDelay", retry.getBaseDelay()),
                doubleValue(properties, "retry.backoffMultiplier", retry.getBackoffMultiplier()),
                durationValue(properties, "retry.maxDelay", retry.getMaxDelay())))
            .schedulerConfig(new SchedulerConfig(
                zoneValue(properties, "scheduler.zone", scheduler.getZone())))
            .uploadConfig(new UploadConfig(
                stringValue(properties, "upload.tempDir", upload.getTempDir()),
                longValue(properties, "upload.maxBytes", upload.getMaxUploadBytes()),
                stringValue(properties, "upload.storageRoot", upload.getStorageRoot()),
                stringValue(properties, "upload.bucket", upload.getBucket()),
                stringValue(properties, "upload.publicBaseUrl", upload.getPublicBaseUrl())))
            .handlerConfig(new HandlerConfig(
                durationValue(properties, "handler.simulatedDuration", handler.getSimulatedDuration()),
                stringValue(properties, "mail.from", handler.getMailFrom())))
            .monitoringConfig(new MonitoringConfig(
                booleanValue(properties, "monitoring.enableMetrics", monitoring.isEnableMetrics())))
            .build();
    }

    private static String stringValue(Properties properties, String key, String fallback) {
        String value = properties.getProperty(key);
        return value == null || value.trim().isEmpty() ? fallback : value.trim();
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = stringValue(properties, key, null);
        try {
            return value == null ? fallback : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String value = stringValue(properties, key, null);
        try {
            return value == null ? fallback : Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = stringValue(properties, key, null);
        try {
            return value == null ? fallback : Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = stringValue(properties, key, null);
        return value == null ? fallback : Boolean.parseBoolean(value);
    }

    private static Duration durationValue(Properties properties, String key, Duration fallback) {
        String value = stringValue(properties, key, null);
        try {
            return value == null ? fallback : Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }

    private static ZoneId zoneValue(Properties properties, String key, ZoneId fallback) {
        String value = stringValue(properties, key, null);
        try {
            return value == null ? fallback : ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid time zone for " + key + ": " + value, e);
        }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private StorageConfig storageConfig = Defaults.defaultStorageConfig();
        private RetryConfig retryConfig = Defaults.defaultRetryConfig();
        private SchedulerConfig schedulerConfig = Defaults.defaultSchedulerConfig();
        private UploadConfig uploadConfig = Defaults.defaultUploadConfig();
        private HandlerConfig handlerConfig = Defaults.defaultHandlerConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();

        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }

        public Builder storageConfig(StorageConfig storageConfig) {
            this.storageConfig = storageConfig;
            return this;
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }

        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = schedulerConfig;
            return this;
        }

        public Builder uploadConfig(UploadConfig uploadConfig) {
            this.uploadConfig = uploadConfig;
            return this;
        }

        public Builder handlerConfig(HandlerConfig handlerConfig) {
            this.handlerConfig = handlerConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        public JobSystemConfig build() {
            return new JobSystemConfig(executorConfig, storageConfig, retryConfig, schedulerConfig,
                                       uploadConfig, handlerConfig, monitoringConfig);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static final long MAX_UPLOAD_BYTES = 10L * 1024 * 1024;

        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(4, 1000, Duration.ofSeconds(30));
        }

        public static StorageConfig defaultStorageConfig() {
            return new StorageConfig(tempPath("job-store-" + UUID.randomUUID() + ".db"), false);
        }

        public static RetryConfig defaultRetryConfig() {
            return new RetryConfig(Duration.ofSeconds(1), 2.0, Duration.ofHours(1));
        }

        public static SchedulerConfig defaultSchedulerConfig() {
            return new SchedulerConfig(ZoneOffset.UTC);
        }

        public static UploadConfig defaultUploadConfig() {
            return new UploadConfig(tempPath("job-uploads"), MAX_UPLOAD_BYTES,
                                    tempPath("job-objects"), "job-files", null);
        }

        public static HandlerConfig defaultHandlerConfig() {
            return new HandlerConfig(Duration.ofSeconds(2), "no-reply@example.com");
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true);
        }

        private static String tempPath(String name) {
            return Paths.get(System.getProperty("java.io.tmpdir"), name).toString();
        }
    }
}
