package com.enterprise.taskrouting.orchestrator;

/**
 * Outcome counts of one processing pass
 */
public final class PassSummary {

    private final int dispatched;
    private final int completed;
    private final int failed;
    private final int awaitingApproval;

    public PassSummary(int dispatched, int completed, int failed, int awaitingApproval) {
        this.dispatched = dispatched;
        this.completed = completed;
        this.failed = failed;
        this.awaitingApproval = awaitingApproval;
    }

    public int getDispatched() {
        return dispatched;
    }

    public int getCompleted() {
        return completed;
    }

    public int getFailed() {
        return failed;
    }

    public int getAwaitingApproval() {
        return awaitingApproval;
    }

    @Override
    public String toString() {
        return "PassSummary{" +
                "dispatched=" + dispatched +
                ", completed=" + completed +
                ", failed=" + failed +
                ", awaitingApproval=" + awaitingApproval +
                '}';
    }
}
