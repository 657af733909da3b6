package com.enterprise.taskrouting.exception;

import com.enterprise.taskrouting.core.TaskStatus;

/**
 * Exception thrown when a claim loses the race, targets a task in an
 * ineligible state, or the task's approval requirement is unmet
 */
public class TaskNotClaimableException extends TaskRoutingException {

    private final String taskId;
    private final TaskStatus currentStatus;

    public TaskNotClaimableException(String taskId, TaskStatus currentStatus, String reason) {
        super("Task " + taskId + " is not claimable" +
              (currentStatus != null ? " from status " + currentStatus.wireName() : "") +
              ": " + reason);
        this.taskId = taskId;
        this.currentStatus = currentStatus;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * Status observed when the claim was rejected, null if the task vanished mid-claim
     */
    public TaskStatus getCurrentStatus() {
        return currentStatus;
    }
}
