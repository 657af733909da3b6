package com.enterprise.taskrouting.exception;

/**
 * Exception thrown when a requested task is not found in any partition
 */
public class TaskNotFoundException extends TaskRoutingException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
