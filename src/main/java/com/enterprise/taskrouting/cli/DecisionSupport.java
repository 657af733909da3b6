package com.enterprise.taskrouting.cli;

import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.exception.IllegalTransitionException;
import com.enterprise.taskrouting.exception.TaskNotFoundException;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;

/**
 * Shared body of the approve and deny commands
 */
final class DecisionSupport {

    private DecisionSupport() {
    }

    static int decide(TaskRoutingCommand parent, CommandSpec spec, String taskId, boolean approved, boolean process) {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Task task = parent.engine().getApprovalService().decide(taskId, approved);
            if (approved) {
                ConsoleOutput.success(out, "Approved " + task.getId());
                if (process) {
                    parent.engine().getOrchestrator().processPending();
                    parent.engine().getStore().get(taskId).ifPresent(current ->
                        ConsoleOutput.info(out, "Task " + taskId + " is now " + current.getStatus().wireName()));
                }
            } else {
                ConsoleOutput.success(out, "Denied " + task.getId());
            }
            return 0;
        } catch (TaskNotFoundException e) {
            ConsoleOutput.error(out, "Task not found: " + taskId);
            return 1;
        } catch (IllegalTransitionException e) {
            ConsoleOutput.error(out, "Task " + taskId + " is not awaiting approval (" + e.getMessage() + ")");
            return 1;
        } finally {
            parent.close();
        }
    }
}
