package com.enterprise.taskrouting.retry;

import java.util.Optional;

/**
 * Final disposition of one {@link RetryExecutor#execute} call
 */
public final class ExecutionResult {

    public enum Outcome {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    private final Outcome outcome;
    private final int attempts;
    private final String detail;
    private final FailureClass failureClass;

    private ExecutionResult(Outcome outcome, int attempts, String detail, FailureClass failureClass) {
        this.outcome = outcome;
        this.attempts = attempts;
        this.detail = detail;
        this.failureClass = failureClass;
    }

    static ExecutionResult success(int attempts, String detail) {
        return new ExecutionResult(Outcome.SUCCESS, attempts, detail, null);
    }

    static ExecutionResult failed(int attempts, String detail, FailureClass failureClass) {
        return new ExecutionResult(Outcome.FAILED, attempts, detail, failureClass);
    }

    static ExecutionResult cancelled(int attempts) {
        return new ExecutionResult(Outcome.CANCELLED, attempts, "cancelled", null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isCancelled() {
        return outcome == Outcome.CANCELLED;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Class of the last failure; empty unless the outcome is {@link Outcome#FAILED}
     */
    public Optional<FailureClass> getFailureClass() {
        return Optional.ofNullable(failureClass);
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "outcome=" + outcome +
                ", attempts=" + attempts +
                ", detail='" + detail + '\'' +
                ", failureClass=" + failureClass +
                '}';
    }
}
