package com.enterprise.jobscheduling.handler;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.exception.HandlerNotFoundException;
import com.enterprise.jobscheduling.integration.LoggingMailer;
import com.enterprise.jobscheduling.support.InMemoryObjectStore;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;

class HandlerRegistryTest {
    
    @Test
    void testStandardRegistryCoversEveryType() throws Exception {
        HandlerRegistry registry = HandlerRegistry.standard(new LoggingMailer("no-reply@example.com"),
                                                            new InMemoryObjectStore(), "job-files", Duration.ZERO);
        
        for (JobType type : JobType.values()) {
            assertTrue(registry.hasHandler(type), type.getValue());
        }
        assertTrue(registry.handlerFor(JobType.SEND_EMAIL) instanceof SendEmailHandler);
        assertTrue(registry.handlerFor(JobType.UPLOAD_FILE) instanceof UploadFileHandler);
        assertTrue(registry.handlerFor(JobType.GENERATE_REPORT) instanceof GenericJobHandler);
    }
    
    @Test
    void testUnknownTypeThrows() {
        HandlerRegistry registry = new HandlerRegistry();
        
        HandlerNotFoundException e = assertThrows(HandlerNotFoundException.class,
            () -> registry.handlerFor(JobType.PROCESS_IMAGE));
        assertEquals(JobType.PROCESS_IMAGE, e.getJobType());
    }
    
    @Test
    void testRegisterReplaces() throws Exception {
        JobHandler custom = job -> Map.of("message", "custom");
        HandlerRegistry registry = new HandlerRegistry()
            .register(JobType.FETCH_DATA, new GenericJobHandler(Duration.ZERO))
            .register(JobType.FETCH_DATA, custom);
        
        assertSame(custom, registry.handlerFor(JobType.FETCH_DATA));
    }
    
    @Test
    void testGenericHandlerResult() {
        Job job = Job.builder().jobType(JobType.BACKUP_DATABASE).build();
        
        Map<String, Object> result = new GenericJobHandler(Duration.ofMillis(5)).handle(job);
        
        assertEquals("backup_database completed successfully.", result.get("message"));
    }
}
