package com.enterprise.taskrouting.core;

import java.time.Instant;
import java.util.Optional;

/**
 * Represents a unit of routed work moving through the task state machine.
 * Tasks are immutable; every change produces a new instance that the
 * store persists through one of its transitions.
 */
public interface Task {

    /**
     * Stable identifier: creation time, source and a disambiguating suffix
     */
    String getId();

    /**
     * Producer channel the task came from
     */
    Source getSource();

    /**
     * Short human description, used for the document filename
     */
    String getTitle();

    /**
     * Domain assigned by the classifier, null until classified
     */
    Domain getDomain();

    /**
     * Requested action type, null until classified
     */
    String getIntent();

    /**
     * Priority assigned by the classifier, null until classified
     */
    Priority getPriority();

    TaskStatus getStatus();

    Payload getPayload();

    /**
     * Attempts made by the retry executor for the current execution phase
     */
    int getRetryCount();

    /**
     * Iterations consumed by the completion loop
     */
    int getIterationCount();

    boolean isRequiresApproval();

    /**
     * Human approval decision; null means pending
     */
    Boolean getApproved();

    /**
     * Reason recorded when the task failed
     */
    Optional<String> getFailureReason();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    default boolean isClassified() {
        return getDomain() != null && getIntent() != null && getPriority() != null;
    }

    /**
     * Whether the approval requirement is satisfied, i.e. the task may run
     */
    default boolean isApprovalSatisfied() {
        return !isRequiresApproval() || Boolean.TRUE.equals(getApproved());
    }

    /**
     * Creates a builder pre-populated with this task's values
     */
    TaskImpl.Builder toBuilder();
}
