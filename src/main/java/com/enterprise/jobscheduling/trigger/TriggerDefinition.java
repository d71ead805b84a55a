package com.enterprise.jobscheduling.trigger;

import com.enterprise.jobscheduling.schedule.RecurrenceRule;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A named scheduling registration. Recurring triggers carry a rule, one-off triggers an instant.
 */
public final class TriggerDefinition {

    public enum Kind {
        RECURRING,
        ONE_OFF
    }

    private final String name;
    private final Kind kind;
    private final RecurrenceRule rule;
    private final Instant instant;
    private final boolean enabled;
    private final TaskRef taskRef;
    private final List<String> args;

    private TriggerDefinition(String name, Kind kind, RecurrenceRule rule, Instant instant,
                              boolean enabled, TaskRef taskRef, List<String> args) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.rule = rule;
        this.instant = instant;
        this.enabled = enabled;
        this.taskRef = Objects.requireNonNull(taskRef, "taskRef");
        this.args = args != null ? List.copyOf(args) : List.of();
    }

    public static TriggerDefinition recurring(String name, RecurrenceRule rule, boolean enabled,
                                              TaskRef taskRef, List<String> args) {
        return new TriggerDefinition(name, Kind.RECURRING, Objects.requireNonNull(rule, "rule"),
                                     null, enabled, taskRef, args);
    }

    public static TriggerDefinition oneOff(String name, Instant instant, TaskRef taskRef,
                                           List<String> args, boolean enabled) {
        return new TriggerDefinition(name, Kind.ONE_OFF, null, Objects.requireNonNull(instant, "instant"),
                                     enabled, taskRef, args);
    }

    public String getName() { return name; }
    public Kind getKind() { return kind; }
    public RecurrenceRule getRule() { return rule; }
    public Instant getInstant() { return instant; }
    public boolean isEnabled() { return enabled; }
    public TaskRef getTaskRef() { return taskRef; }
    public List<String> getArgs() { return args; }

    public String getFirstArg() {
        return args.isEmpty() ? null : args.get(0);
    }

    public TriggerDefinition withEnabled(boolean enabled) {
        return new TriggerDefinition(name, kind, rule, instant, enabled, taskRef, args);
    }

    @Override
    public String toString() {
        return String.format("Trigger[%s %s %s, enabled=%s, task=%s, args=%s]",
            name, kind, kind == Kind.RECURRING ? rule : instant, enabled, taskRef.getValue(), args);
    }
}
