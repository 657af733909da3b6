package com.enterprise.taskrouting.core;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of the Task interface
 */
public class TaskImpl implements Task {

    private final String id;
    private final Source source;
    private final String title;
    private final Domain domain;
    private final String intent;
    private final Priority priority;
    private final TaskStatus status;
    private final Payload payload;
    private final int retryCount;
    private final int iterationCount;
    private final boolean requiresApproval;
    private final Boolean approved;
    private final String failureReason;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TaskImpl(Builder builder) {
        this.id = builder.id;
        this.source = builder.source;
        this.title = builder.title;
        this.domain = builder.domain;
        this.intent = builder.intent;
        this.priority = builder.priority;
        this.status = builder.status;
        this.payload = builder.payload;
        this.retryCount = builder.retryCount;
        this.iterationCount = builder.iterationCount;
        this.requiresApproval = builder.requiresApproval;
        this.approved = builder.approved;
        this.failureReason = builder.failureReason;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    @Override
    public String getId() { return id; }

    @Override
    public Source getSource() { return source; }

    @Override
    public String getTitle() { return title; }

    @Override
    public Domain getDomain() { return domain; }

    @Override
    public String getIntent() { return intent; }

    @Override
    public Priority getPriority() { return priority; }

    @Override
    public TaskStatus getStatus() { return status; }

    @Override
    public Payload getPayload() { return payload; }

    @Override
    public int getRetryCount() { return retryCount; }

    @Override
    public int getIterationCount() { return iterationCount; }

    @Override
    public boolean isRequiresApproval() { return requiresApproval; }

    @Override
    public Boolean getApproved() { return approved; }

    @Override
    public Optional<String> getFailureReason() { return Optional.ofNullable(failureReason); }

    @Override
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .source(source)
            .title(title)
            .domain(domain)
            .intent(intent)
            .priority(priority)
            .status(status)
            .payload(payload)
            .retryCount(retryCount)
            .iterationCount(iterationCount)
            .requiresApproval(requiresApproval)
            .approved(approved)
            .failureReason(failureReason)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskImpl)) return false;
        TaskImpl that = (TaskImpl) o;
        return retryCount == that.retryCount
            && iterationCount == that.iterationCount
            && requiresApproval == that.requiresApproval
            && Objects.equals(id, that.id)
            && source == that.source
            && Objects.equals(title, that.title)
            && domain == that.domain
            && Objects.equals(intent, that.intent)
            && priority == that.priority
            && status == that.status
            && Objects.equals(payload, that.payload)
            && Objects.equals(approved, that.approved)
            && Objects.equals(failureReason, that.failureReason)
            && Objects.equals(createdAt, that.createdAt)
            && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, updatedAt);
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", source=" + source +
                ", status=" + status +
                ", domain=" + domain +
                ", intent='" + intent + '\'' +
                ", priority=" + priority +
                ", retryCount=" + retryCount +
                ", iterationCount=" + iterationCount +
                ", requiresApproval=" + requiresApproval +
                ", approved=" + approved +
                '}';
    }

    /**
     * Builder for creating Task instances
     */
    public static class Builder {
        private String id;
        private Source source = Source.UNKNOWN;
        private String title = "";
        private Domain domain;
        private String intent;
        private Priority priority;
        private TaskStatus status = TaskStatus.NEW;
        private Payload payload = Payload.ofBody("");
        private int retryCount = 0;
        private int iterationCount = 0;
        private boolean requiresApproval = false;
        private Boolean approved;
        private String failureReason;
        private Instant createdAt = Instant.now();
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(Source source) {
            this.source = source;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder domain(Domain domain) {
            this.domain = domain;
            return this;
        }

        public Builder intent(String intent) {
            this.intent = intent;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder payload(Payload payload) {
            this.payload = payload;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder iterationCount(int iterationCount) {
            this.iterationCount = iterationCount;
            return this;
        }

        public Builder requiresApproval(boolean requiresApproval) {
            this.requiresApproval = requiresApproval;
            return this;
        }

        public Builder approved(Boolean approved) {
            this.approved = approved;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            if (source == null) {
                throw new IllegalArgumentException("Task source is required");
            }
            if (status == null) {
                throw new IllegalArgumentException("Task status is required");
            }
            if (createdAt == null) {
                throw new IllegalArgumentException("Task creation time is required");
            }
            if (retryCount < 0 || iterationCount < 0) {
                throw new IllegalArgumentException("Task counters cannot be negative");
            }
            if (payload == null) {
                payload = Payload.ofBody("");
            }
            if (title == null) {
                title = "";
            }
            if (updatedAt == null) {
                updatedAt = createdAt;
            }
            return new TaskImpl(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
