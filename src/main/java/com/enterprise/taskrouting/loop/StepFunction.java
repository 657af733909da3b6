package com.enterprise.taskrouting.loop;

import com.enterprise.taskrouting.core.Task;

/**
 * One iteration of work on a task. Throwing is treated as {@link StepOutcome#FAIL};
 * throwing {@link java.util.concurrent.CancellationException} or
 * {@link InterruptedException} cancels the loop instead.
 */
@FunctionalInterface
public interface StepFunction {

    /**
     * @param task current task state, already counting this iteration
     * @param iteration 1-based iteration number
     */
    StepResult apply(Task task, int iteration) throws Exception;
}
