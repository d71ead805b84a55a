package com.enterprise.jobscheduling.trigger;

import com.enterprise.jobscheduling.schedule.RecurrenceRule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Registry of named scheduling registrations.
 * Upserts replace any trigger of the same name, so a name is registered at most once.
 */
public interface TriggerStore {
    
    /**
     * Register or replace a recurring trigger
     */
    void upsertRecurring(String name, RecurrenceRule rule, boolean enabled, TaskRef taskRef, List<String> args);
    
    /**
     * Register or replace a trigger that fires once at the given instant
     */
    void upsertOneOff(String name, Instant instant, TaskRef taskRef, List<String> args, boolean enabled);
    
    /**
     * Delete a trigger by name
     * @return false if no trigger had that name
     */
    boolean delete(String name);
    
    /**
     * Enable a trigger by name
     * @return false if no trigger had that name
     */
    boolean enable(String name);
    
    Optional<TriggerDefinition> find(String name);
    
    List<TriggerDefinition> findAll();
}
