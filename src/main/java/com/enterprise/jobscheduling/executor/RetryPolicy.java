package com.enterprise.jobscheduling.executor;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.exception.SourceFileMissingException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Decides whether a failed job is resubmitted and how long it waits
 */
public interface RetryPolicy {

    /**
     * Whether a failure of this kind enters the retry path at all.
     * Failures that are not retryable leave the retry counter untouched.
     */
    boolean isRetryable(Throwable failure);

    /**
     * Determine if a failed job should be resubmitted
     * @param job the job with its retry counter already incremented for this failure
     */
    boolean shouldRetry(Job job);

    /**
     * Calculate the delay before the next attempt
     * @param job the job with its retry counter already incremented for this failure
     */
    Duration getRetryDelay(Job job);

    /**
     * Exponential backoff with the ceiling taken from each job's {@code maxRetries}
     */
    class DefaultRetryPolicy implements RetryPolicy {
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;
        private final Predicate<Throwable> retryableExceptions;

        public DefaultRetryPolicy(Duration baseDelay, double backoffMultiplier, Duration maxDelay,
                                  Predicate<Throwable> retryableExceptions) {
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
            this.retryableExceptions = retryableExceptions;
        }

        @Override
        public boolean isRetryable(Throwable failure) {
            return retryableExceptions.test(failure);
        }

        @Override
        public boolean shouldRetry(Job job) {
            return job.getRetries() <= job.getMaxRetries();
        }

        @Override
        public Duration getRetryDelay(Job job) {
            double delayMs = baseDelay.toMillis() * Math.pow(backoffMultiplier, job.getRetries());
            long maxDelayMs = maxDelay.toMillis();
            return Duration.ofMillis(delayMs >= maxDelayMs ? maxDelayMs : (long) delayMs);
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }
    }

    /**
     * Builder for creating retry policies
     */
    class Builder {
        private Duration baseDelay = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxDelay = Duration.ofHours(1);
        private Predicate<Throwable> retryableExceptions = ex -> !(ex instanceof SourceFileMissingException);

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder retryableExceptions(Predicate<Throwable> retryableExceptions) {
            this.retryableExceptions = retryableExceptions;
            return this;
        }

        public RetryPolicy build() {
            return new DefaultRetryPolicy(baseDelay, backoffMultiplier, maxDelay, retryableExceptions);
        }
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Doubling backoff from one second: 2s after the first failure, 4s after the second, and so on
     */
    static RetryPolicy standard() {
        return builder().build();
    }
}
