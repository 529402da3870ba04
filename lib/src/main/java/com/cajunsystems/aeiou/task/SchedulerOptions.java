package com.cajunsystems.aeiou.task;

import java.util.Objects;

public record SchedulerOptions(DuplicateTaskPolicy duplicates, ResultRouting routing) {
    private static final SchedulerOptions DEFAULTS = new SchedulerOptions(DuplicateTaskPolicy.REPLACE, ResultRouting.ROOT);

    public SchedulerOptions {
        Objects.requireNonNull(duplicates, "duplicates");
        Objects.requireNonNull(routing, "routing");
    }

    public static SchedulerOptions defaults() {
        return DEFAULTS;
    }

    public SchedulerOptions withDuplicates(DuplicateTaskPolicy duplicates) {
        return new SchedulerOptions(duplicates, routing);
    }

    public SchedulerOptions withRouting(ResultRouting routing) {
        return new SchedulerOptions(duplicates, routing);
    }
}
