package com.enterprise.jobscheduling.trigger;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.schedule.RecurrenceRule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

class CronTriggerStoreTest {
    
    private CronTriggerStore store;
    private List<TriggerDefinition> fired;
    private CountDownLatch fireLatch;
    
    @BeforeEach
    void setUp() {
        store = new CronTriggerStore(ZoneOffset.UTC);
        fired = new CopyOnWriteArrayList<>();
        fireLatch = new CountDownLatch(1);
        store.setFireListener(trigger -> {
            fired.add(trigger);
            fireLatch.countDown();
        });
    }
    
    @AfterEach
    void tearDown() {
        store.stop();
    }
    
    @Test
    void testUpsertReplacesTriggerWithSameName() {
        RecurrenceRule daily = RecurrenceRule.of(Frequency.DAILY, ZonedDateTime.parse("2030-01-01T06:00:00Z"));
        RecurrenceRule weekly = RecurrenceRule.of(Frequency.WEEKLY, ZonedDateTime.parse("2030-01-01T06:00:00Z"));
        
        store.upsertRecurring("job-1", daily, true, TaskRef.EXECUTE_JOB, List.of("1"));
        store.upsertRecurring("job-1", weekly, false, TaskRef.EXECUTE_JOB, List.of("1"));
        
        assertEquals(1, store.findAll().size());
        TriggerDefinition stored = store.find("job-1").orElseThrow();
        assertEquals(weekly, stored.getRule());
        assertFalse(stored.isEnabled());
        assertEquals(TriggerDefinition.Kind.RECURRING, stored.getKind());
    }
    
    @Test
    void testDeleteIsIdempotent() {
        store.upsertOneOff("enable-job-1", Instant.now().plusSeconds(3600), TaskRef.ENABLE_TRIGGER,
                           List.of("job-1"), true);
        
        assertTrue(store.delete("enable-job-1"));
        assertFalse(store.delete("enable-job-1"));
        assertTrue(store.find("enable-job-1").isEmpty());
    }
    
    @Test
    @Timeout(5)
    void testOneOffFiresOnceAndDisablesItself() throws Exception {
        String target = UUID.randomUUID().toString();
        store.upsertOneOff("once", Instant.now().plusMillis(200), TaskRef.EXECUTE_JOB, List.of(target), true);
        
        assertTrue(fireLatch.await(3, TimeUnit.SECONDS));
        
        assertEquals(1, fired.size());
        assertEquals(target, fired.get(0).getFirstArg());
        assertFalse(store.find("once").orElseThrow().isEnabled());
    }
    
    @Test
    void testDisabledOneOffWaitsForEnable() throws Exception {
        store.upsertOneOff("later", Instant.now().plusMillis(100), TaskRef.EXECUTE_JOB, List.of("x"), false);
        
        Thread.sleep(400);
        assertTrue(fired.isEmpty());
        
        assertTrue(store.enable("later"));
        assertTrue(fireLatch.await(3, TimeUnit.SECONDS));
        assertEquals(1, fired.size());
    }
    
    @Test
    void testDeletedOneOffNeverFires() throws Exception {
        store.upsertOneOff("gone", Instant.now().plusMillis(200), TaskRef.EXECUTE_JOB, List.of("x"), true);
        store.delete("gone");
        
        assertFalse(fireLatch.await(600, TimeUnit.MILLISECONDS));
        assertTrue(fired.isEmpty());
    }
    
    @Test
    void testEnableUnknownTrigger() {
        assertFalse(store.enable("missing"));
    }
    
    @Test
    void testEnablingRecurringTriggerInMatchingMinuteFiresOnce() throws Exception {
        waitForFreshMinute();
        RecurrenceRule hourly = RecurrenceRule.of(Frequency.HOURLY, ZonedDateTime.now(ZoneOffset.UTC));
        store.upsertRecurring("job-now", hourly, false, TaskRef.EXECUTE_JOB, List.of("now"));
        
        assertTrue(store.enable("job-now"));
        assertTrue(store.enable("job-now"));
        
        assertEquals(1, fired.size());
        assertEquals("job-now", fired.get(0).getName());
        assertTrue(store.find("job-now").orElseThrow().isEnabled());
    }
    
    @Test
    void testEnablingRecurringTriggerOutsideItsMinuteDoesNotFire() {
        RecurrenceRule yearly = RecurrenceRule.of(Frequency.YEARLY,
            ZonedDateTime.now(ZoneOffset.UTC).plusMonths(6));
        store.upsertRecurring("job-later", yearly, false, TaskRef.EXECUTE_JOB, List.of("later"));
        
        assertTrue(store.enable("job-later"));
        
        assertTrue(fired.isEmpty());
    }
    
    @Test
    void testStartAndStop() {
        store.start();
        assertTrue(store.isRunning());
        store.upsertOneOff("x", Instant.now().plusSeconds(60), TaskRef.EXECUTE_JOB, List.of("x"), true);
        
        store.stop();
        
        assertFalse(store.isRunning());
        assertTrue(store.findAll().isEmpty());
    }
    
    private static void waitForFreshMinute() throws InterruptedException {
        int second = ZonedDateTime.now(ZoneOffset.UTC).getSecond();
        if (second >= 55) {
            Thread.sleep((61 - second) * 1000L);
        }
    }
}
