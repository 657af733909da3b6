package com.enterprise.taskrouting.exception;

import com.enterprise.taskrouting.core.TaskStatus;

/**
 * Exception thrown when a transition is not allowed by the task state machine
 */
public class IllegalTransitionException extends TaskRoutingException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Illegal transition for task " + taskId + ": " + from.wireName() + " -> " + to.wireName());
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
