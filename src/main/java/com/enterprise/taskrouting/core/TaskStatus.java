package com.enterprise.taskrouting.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Represents the status of a task in the routing engine.
 * Each status maps to exactly one partition directory of the task store.
 */
public enum TaskStatus {
    NEW("new"),                     // Deposited by a producer, not yet routed
    NEEDS_ACTION("needs_action"),   // Held by the approval gate
    IN_PROGRESS("in_progress"),     // Claimed by a worker
    DONE("done"),                   // Completed successfully
    FAILED("failed");               // Failed, denied or quarantined

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in task documents and as the partition directory name
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        return Arrays.stream(values())
            .filter(status -> status.wireName.equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + value));
    }
}
