package com.enterprise.jobscheduling.executor;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.exception.SourceFileMissingException;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;

class RetryPolicyTest {
    
    @Test
    void testStandardBackoffDoubles() {
        RetryPolicy policy = RetryPolicy.standard();
        
        assertEquals(Duration.ofSeconds(2), policy.getRetryDelay(withRetries(1, 3)));
        assertEquals(Duration.ofSeconds(4), policy.getRetryDelay(withRetries(2, 3)));
        assertEquals(Duration.ofSeconds(8), policy.getRetryDelay(withRetries(3, 3)));
    }
    
    @Test
    void testDelayIsCapped() {
        RetryPolicy policy = RetryPolicy.builder()
            .baseDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(10))
            .build();
        
        assertEquals(Duration.ofSeconds(8), policy.getRetryDelay(withRetries(3, 50)));
        assertEquals(Duration.ofSeconds(10), policy.getRetryDelay(withRetries(4, 50)));
        assertEquals(Duration.ofSeconds(10), policy.getRetryDelay(withRetries(40, 50)));
    }
    
    @Test
    void testCustomMultiplier() {
        RetryPolicy policy = RetryPolicy.builder()
            .baseDelay(Duration.ofMillis(100))
            .backoffMultiplier(3.0)
            .build();
        
        assertEquals(Duration.ofMillis(900), policy.getRetryDelay(withRetries(2, 3)));
    }
    
    @Test
    void testShouldRetryUsesJobCeiling() {
        RetryPolicy policy = RetryPolicy.standard();
        
        assertTrue(policy.shouldRetry(withRetries(1, 3)));
        assertTrue(policy.shouldRetry(withRetries(3, 3)));
        assertFalse(policy.shouldRetry(withRetries(4, 3)));
        assertFalse(policy.shouldRetry(withRetries(1, 0)));
        assertTrue(policy.shouldRetry(withRetries(7, 10)));
    }
    
    @Test
    void testMissingSourceIsNotRetryable() {
        RetryPolicy policy = RetryPolicy.standard();
        
        assertFalse(policy.isRetryable(new SourceFileMissingException(UUID.randomUUID(), "/tmp/x")));
        assertTrue(policy.isRetryable(new IOException("timeout")));
        assertTrue(policy.isRetryable(new IllegalStateException()));
    }
    
    @Test
    void testCustomRetryableExceptions() {
        RetryPolicy policy = RetryPolicy.builder()
            .retryableExceptions(ex -> ex instanceof IOException)
            .build();
        
        assertTrue(policy.isRetryable(new IOException()));
        assertFalse(policy.isRetryable(new IllegalArgumentException()));
    }
    
    private static Job withRetries(int retries, int maxRetries) {
        return Job.builder().jobType(JobType.FETCH_DATA).retries(retries).maxRetries(maxRetries).build();
    }
}
