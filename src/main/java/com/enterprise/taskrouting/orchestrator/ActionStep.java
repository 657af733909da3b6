package com.enterprise.taskrouting.orchestrator;

import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.loop.StepFunction;
import com.enterprise.taskrouting.loop.StepResult;
import com.enterprise.taskrouting.retry.ExecutionResult;
import com.enterprise.taskrouting.retry.RetryExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Default step: one external action per iteration through the retry executor.
 * <p>
 * A task without {@code steps} runs the single action named after its intent.
 * A task listing {@code steps} (e.g. {@code draft,refine,finalize}) runs
 * {@code <intent>.<step>} for each in turn, tracking progress in the
 * {@code completed_steps} payload field so a resumed task continues where it stopped.
 */
public class ActionStep implements StepFunction {

    static final String COMPLETED_STEPS = "completed_steps";
    private static final String DEFAULT_INTENT = "update";

    private final RetryExecutor retryExecutor;

    public ActionStep(RetryExecutor retryExecutor) {
        this.retryExecutor = retryExecutor;
    }

    @Override
    public StepResult apply(Task task, int iteration) {
        Payload payload = task.getPayload();
        String intent = task.getIntent() != null ? task.getIntent() : DEFAULT_INTENT;
        List<String> steps = steps(payload);

        if (steps.isEmpty()) {
            ExecutionResult result = retryExecutor.execute(task.getId(), intent, payload);
            if (result.isCancelled()) {
                throw new CancellationException("Action " + intent + " cancelled");
            }
            return result.isSuccess()
                ? StepResult.complete(payload, result.getDetail()).recorded()
                : StepResult.fail(payload, "action_failed: " + result.getDetail()).recorded();
        }

        int completed = completedSteps(payload);
        if (completed >= steps.size()) {
            return StepResult.complete(payload, "all steps already completed");
        }
        String step = steps.get(completed);
        String actionName = intent + "." + step;

        ExecutionResult result = retryExecutor.execute(task.getId(), actionName, payload);
        if (result.isCancelled()) {
            throw new CancellationException("Action " + actionName + " cancelled");
        }
        if (!result.isSuccess()) {
            return StepResult.fail(payload, "action_failed: " + step + ": " + result.getDetail()).recorded();
        }

        Payload advanced = payload.withField(COMPLETED_STEPS, String.valueOf(completed + 1));
        if (completed + 1 == steps.size()) {
            return StepResult.complete(advanced, result.getDetail()).recorded();
        }
        return StepResult.continueWith(advanced);
    }

    static List<String> steps(Payload payload) {
        List<String> steps = new ArrayList<>();
        payload.field(Payload.STEPS).ifPresent(value -> {
            for (String step : value.split(",")) {
                if (!step.isBlank()) {
                    steps.add(step.trim());
                }
            }
        });
        return steps;
    }

    private static int completedSteps(Payload payload) {
        return payload.field(COMPLETED_STEPS).map(value -> {
            try {
                return Math.max(0, Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }).orElse(0);
    }
}
