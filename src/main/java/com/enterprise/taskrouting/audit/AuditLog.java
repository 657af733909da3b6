package com.enterprise.taskrouting.audit;

import com.enterprise.taskrouting.core.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only ledger of orchestration events.
 * Implementations must serialize concurrent writers and never modify
 * or delete an entry once written.
 */
public interface AuditLog {

    /**
     * Appends an entry. Returns only after the entry is durable.
     */
    void append(AuditEntry entry);

    /**
     * Reads every entry in append order
     */
    List<AuditEntry> readAll();

    /**
     * Convenience for appending an entry stamped with the log's clock
     */
    AuditEntry record(String taskId, AuditEventType eventType, String detail, TaskStatus statusAfter);

    default List<AuditEntry> readForTask(String taskId) {
        return readAll().stream()
            .filter(entry -> entry.getTaskId().equals(taskId))
            .collect(Collectors.toList());
    }

    /**
     * Entries with {@code from <= timestamp < to}
     */
    default List<AuditEntry> readBetween(Instant from, Instant to) {
        return readAll().stream()
            .filter(entry -> !entry.getTimestamp().isBefore(from) && entry.getTimestamp().isBefore(to))
            .collect(Collectors.toList());
    }
}
