package com.enterprise.taskrouting.audit;

import com.enterprise.taskrouting.core.TaskStatus;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one orchestration event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AuditEntry {

    private final Instant timestamp;
    private final String taskId;
    private final AuditEventType eventType;
    private final String detail;
    private final TaskStatus statusAfter;

    @JsonCreator
    public AuditEntry(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("task_id") String taskId,
            @JsonProperty("event_type") AuditEventType eventType,
            @JsonProperty("detail") String detail,
            @JsonProperty("status_after") TaskStatus statusAfter) {
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.taskId = Objects.requireNonNull(taskId, "Task ID cannot be null");
        this.eventType = Objects.requireNonNull(eventType, "Event type cannot be null");
        this.detail = detail != null ? detail : "";
        this.statusAfter = statusAfter;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("task_id")
    public String getTaskId() {
        return taskId;
    }

    @JsonProperty("event_type")
    public AuditEventType getEventType() {
        return eventType;
    }

    @JsonProperty("detail")
    public String getDetail() {
        return detail;
    }

    /**
     * Task status after the event; null for events not tied to a task state
     */
    @JsonProperty("status_after")
    public TaskStatus getStatusAfter() {
        return statusAfter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AuditEntry that = (AuditEntry) o;
        return timestamp.equals(that.timestamp)
            && taskId.equals(that.taskId)
            && eventType == that.eventType
            && detail.equals(that.detail)
            && statusAfter == that.statusAfter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, taskId, eventType, detail, statusAfter);
    }

    @Override
    public String toString() {
        return "AuditEntry{" +
                "timestamp=" + timestamp +
                ", taskId='" + taskId + '\'' +
                ", eventType=" + eventType +
                ", detail='" + detail + '\'' +
                ", statusAfter=" + statusAfter +
                '}';
    }
}
