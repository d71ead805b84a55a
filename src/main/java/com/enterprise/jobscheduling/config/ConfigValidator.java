package com.enterprise.jobscheduling.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates job system configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(JobSystemConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateExecutorConfig(config.getExecutorConfig(), errors);
        validateStorageConfig(config.getStorageConfig(), errors);
        validateRetryConfig(config.getRetryConfig(), errors);
        validateSchedulerConfig(config.getSchedulerConfig(), errors);
        validateUploadConfig(config.getUploadConfig(), errors);
        validateHandlerConfig(config.getHandlerConfig(), errors);

        return errors;
    }

    private void validateExecutorConfig(JobSystemConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config.getPoolSize() <= 0) {
            errors.add(new ValidationError("executor.poolSize",
                "Pool size must be greater than 0"));
        }

        if (config.getQueueCapacity() <= 0) {
            errors.add(new ValidationError("executor.queueCapacity",
                "Queue capacity must be greater than 0"));
        }

        if (config.getShutdownTimeout() == null || config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("executor.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }

    private void validateStorageConfig(JobSystemConfig.StorageConfig config, List<ValidationError> errors) {
        if (!config.isInMemory() && (config.getDbPath() == null || config.getDbPath().trim().isEmpty())) {
            errors.add(new ValidationError("storage.dbPath",
                "Database path is required unless the store is in memory"));
        }
    }

    private void validateRetryConfig(JobSystemConfig.RetryConfig config, List<ValidationError> errors) {
        if (config.getBaseDelay() == null || config.getBaseDelay().isNegative()) {
            errors.add(new ValidationError("retry.baseDelay",
                "Base delay cannot be negative"));
        }

        if (config.getBackoffMultiplier() < 1.0) {
            errors.add(new ValidationError("retry.backoffMultiplier",
                "Backoff multiplier must be at least 1"));
        }

        if (config.getMaxDelay() == null || config.getMaxDelay().isNegative()) {
            errors.add(new ValidationError("retry.maxDelay",
                "Maximum delay cannot be negative"));
        } else if (config.getBaseDelay() != null && config.getBaseDelay().compareTo(config.getMaxDelay()) > 0) {
            errors.add(new ValidationError("retry.delayRange",
                "Base delay cannot be greater than maximum delay"));
        }
    }

    private void validateSchedulerConfig(JobSystemConfig.SchedulerConfig config, List<ValidationError> errors) {
        if (config.getZone() == null) {
            errors.add(new ValidationError("scheduler.zone",
                "Time zone is required"));
        }
    }

    private void validateUploadConfig(JobSystemConfig.UploadConfig config, List<ValidationError> errors) {
        if (config.getTempDir() == null || config.getTempDir().trim().isEmpty()) {
            errors.add(new ValidationError("upload.tempDir",
                "Upload directory is required"));
        }

        if (config.getMaxUploadBytes() <= 0) {
            errors.add(new ValidationError("upload.maxBytes",
                "Maximum upload size must be greater than 0"));
        }

        if (config.getStorageRoot() == null || config.getStorageRoot().trim().isEmpty()) {
            errors.add(new ValidationError("upload.storageRoot",
                "Object storage root is required"));
        }

        if (config.getBucket() == null || config.getBucket().trim().isEmpty()) {
            errors.add(new ValidationError("upload.bucket",
                "Bucket name is required"));
        }
    }

    private void validateHandlerConfig(JobSystemConfig.HandlerConfig config, List<ValidationError> errors) {
        if (config.getSimulatedDuration() == null || config.getSimulatedDuration().isNegative()) {
            errors.add(new ValidationError("handler.simulatedDuration",
                "Simulated duration cannot be negative"));
        }
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
