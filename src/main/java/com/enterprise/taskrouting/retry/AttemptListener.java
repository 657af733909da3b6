package com.enterprise.taskrouting.retry;

/**
 * Notified before each attempt so the attempt counter can be persisted on the task
 */
@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = (taskId, attempt) -> { };

    void beforeAttempt(String taskId, int attempt);
}
