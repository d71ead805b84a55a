package com.enterprise.jobscheduling.trigger;

/**
 * Callback invoked by a {@link TriggerStore} each time a trigger fires
 */
@FunctionalInterface
public interface TriggerFireListener {
    
    void onFire(TriggerDefinition trigger);
}
