package com.enterprise.taskrouting.loop;

/**
 * Signal returned by a step function
 */
public enum StepOutcome {
    CONTINUE,
    COMPLETE,
    FAIL
}
