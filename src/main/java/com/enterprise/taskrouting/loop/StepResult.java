package com.enterprise.taskrouting.loop;

import com.enterprise.taskrouting.core.Payload;

/**
 * Result of one step: the outcome signal plus the updated task payload.
 * {@code recorded} is set when the step already wrote the terminal audit
 * entry itself, e.g. through the retry executor.
 */
public final class StepResult {

    private final StepOutcome outcome;
    private final Payload payload;
    private final String detail;
    private final boolean recorded;

    private StepResult(StepOutcome outcome, Payload payload, String detail, boolean recorded) {
        this.outcome = outcome;
        this.payload = payload;
        this.detail = detail != null ? detail : "";
        this.recorded = recorded;
    }

    public static StepResult continueWith(Payload payload) {
        return new StepResult(StepOutcome.CONTINUE, payload, "", false);
    }

    public static StepResult complete(Payload payload, String detail) {
        return new StepResult(StepOutcome.COMPLETE, payload, detail, false);
    }

    public static StepResult fail(Payload payload, String reason) {
        return new StepResult(StepOutcome.FAIL, payload, reason, false);
    }

    /**
     * Same result, marked as already audited
     */
    public StepResult recorded() {
        return new StepResult(outcome, payload, detail, true);
    }

    public StepOutcome getOutcome() {
        return outcome;
    }

    public Payload getPayload() {
        return payload;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isRecorded() {
        return recorded;
    }
}
