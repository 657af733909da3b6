package com.enterprise.taskrouting.orchestrator;

import com.enterprise.taskrouting.approval.ApprovalListener;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.exception.DuplicateTaskException;

import java.util.concurrent.CompletableFuture;

/**
 * Drives tasks from intake to a terminal state
 */
public interface Orchestrator extends ApprovalListener {

    /**
     * Registers a task programmatically and schedules it for processing
     */
    Task submit(Task task) throws DuplicateTaskException;

    /**
     * Scans intake and approved {@code needs_action} tasks and dispatches them to workers
     *
     * @return number of tasks dispatched
     */
    int pollOnce();

    /**
     * Runs one poll and waits until every task it dispatched has stopped processing
     */
    PassSummary processPending();

    /**
     * Start fixed-delay polling
     */
    void start();

    /**
     * Stop polling, cancel in-flight loops and requeue their tasks
     */
    CompletableFuture<Void> stop();

    boolean isRunning();

    int getInFlightCount();
}
