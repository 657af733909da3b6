package com.enterprise.taskrouting.exception;

/**
 * Exception thrown when enqueueing a task whose id already exists in the store
 */
public class DuplicateTaskException extends TaskRoutingException {

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task already exists: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
