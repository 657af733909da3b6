package com.enterprise.taskrouting.loop;

import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.IllegalTransitionException;
import com.enterprise.taskrouting.exception.TaskNotFoundException;
import com.enterprise.taskrouting.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Drives an {@code in_progress} task through repeated step calls until the step
 * completes or fails it, or the iteration cap is reached.
 * <p>
 * The iteration counter is persisted on the task before each step runs, so a
 * resumed task keeps its consumed budget and the loop cannot run more than
 * {@code maxIterations} steps in total.
 */
public class CompletionLoop {

    private static final Logger logger = LoggerFactory.getLogger(CompletionLoop.class);

    public static final String ITERATION_CAP_EXCEEDED = "iteration_cap_exceeded";

    private final TaskStore store;
    private final AuditLog auditLog;
    private final int maxIterations;
    private final BooleanSupplier shutdownSignal;

    public CompletionLoop(TaskStore store, AuditLog auditLog, int maxIterations) {
        this(store, auditLog, maxIterations, () -> false);
    }

    public CompletionLoop(TaskStore store, AuditLog auditLog, int maxIterations, BooleanSupplier shutdownSignal) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Max iterations must be at least 1");
        }
        this.store = store;
        this.auditLog = auditLog;
        this.maxIterations = maxIterations;
        this.shutdownSignal = shutdownSignal;
    }

    /**
     * Runs the loop on a claimed task.
     *
     * @throws IllegalTransitionException if the task leaves {@code in_progress} underneath the loop
     */
    public LoopResult run(Task task, StepFunction step) throws TaskNotFoundException, IllegalTransitionException {
        String id = task.getId();
        if (task.getStatus() != TaskStatus.IN_PROGRESS) {
            throw new IllegalTransitionException(id, task.getStatus(), TaskStatus.IN_PROGRESS);
        }

        Task current = task;
        while (true) {
            if (isCancelled()) {
                logger.info("Completion loop for task {} cancelled after {} iterations", id, current.getIterationCount());
                return new LoopResult(LoopResult.Outcome.CANCELLED, current, "cancelled");
            }
            if (current.getIterationCount() >= maxIterations) {
                Task failed = store.fail(id, ITERATION_CAP_EXCEEDED);
                auditLog.record(id, AuditEventType.FAILURE,
                    ITERATION_CAP_EXCEEDED + " after " + maxIterations + " iterations", failed.getStatus());
                logger.warn("Task {} exceeded the iteration cap of {}", id, maxIterations);
                return new LoopResult(LoopResult.Outcome.FAILED, failed, ITERATION_CAP_EXCEEDED);
            }

            current = store.update(id, TaskStatus.IN_PROGRESS,
                t -> t.toBuilder().iterationCount(t.getIterationCount() + 1).build());
            int iteration = current.getIterationCount();

            StepResult result;
            try {
                result = step.apply(current, iteration);
            } catch (CancellationException e) {
                return new LoopResult(LoopResult.Outcome.CANCELLED, current, "cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new LoopResult(LoopResult.Outcome.CANCELLED, current, "cancelled");
            } catch (Exception e) {
                logger.error("Step {} of task {} threw", iteration, id, e);
                result = StepResult.fail(current.getPayload(), "step_error: " + e.getMessage());
            }

            Payload updatedPayload = result.getPayload();
            if (updatedPayload != null && !updatedPayload.equals(current.getPayload())) {
                current = store.update(id, TaskStatus.IN_PROGRESS, t -> t.toBuilder().payload(updatedPayload).build());
            }

            switch (result.getOutcome()) {
                case COMPLETE: {
                    Task done = store.complete(id);
                    if (!result.isRecorded()) {
                        auditLog.record(id, AuditEventType.SUCCESS, describe(result, "completed"), done.getStatus());
                    }
                    logger.info("Task {} completed after {} iterations", id, iteration);
                    return new LoopResult(LoopResult.Outcome.COMPLETED, done, result.getDetail());
                }
                case FAIL: {
                    String reason = result.getDetail().isEmpty() ? "step_failed" : result.getDetail();
                    Task failed = store.fail(id, reason);
                    if (!result.isRecorded()) {
                        auditLog.record(id, AuditEventType.FAILURE, reason, failed.getStatus());
                    }
                    logger.info("Task {} failed after {} iterations: {}", id, iteration, reason);
                    return new LoopResult(LoopResult.Outcome.FAILED, failed, reason);
                }
                default:
                    logger.debug("Task {} continues after iteration {}", id, iteration);
            }
        }
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    private boolean isCancelled() {
        return Thread.currentThread().isInterrupted() || shutdownSignal.getAsBoolean();
    }

    private static String describe(StepResult result, String fallback) {
        return result.getDetail().isEmpty() ? fallback : result.getDetail();
    }
}
