package com.enterprise.taskrouting.loop;

import com.enterprise.taskrouting.core.Task;

/**
 * Terminal result of a completion loop run
 */
public final class LoopResult {

    public enum Outcome {
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private final Outcome outcome;
    private final Task task;
    private final String reason;

    LoopResult(Outcome outcome, Task task, String reason) {
        this.outcome = outcome;
        this.task = task;
        this.reason = reason;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * Task state after the loop: done, failed, or still in progress when cancelled
     */
    public Task getTask() {
        return task;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return outcome + (reason.isEmpty() ? "" : " (" + reason + ")");
    }
}
