package com.enterprise.taskrouting.cli;

import com.enterprise.taskrouting.TaskRoutingEngine;
import com.enterprise.taskrouting.audit.AuditEntry;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskStatus;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: task-routing status [task-id]
 * <p>
 * Without an id, shows partition counts and the tasks awaiting approval.
 * With an id, shows the task and its audit trail.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show store or task status")
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private TaskRoutingCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Task ID")
    private String taskId;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            TaskRoutingEngine engine = parent.engine();
            return taskId == null ? overview(engine, out) : task(engine, out);
        } finally {
            parent.close();
        }
    }

    private int overview(TaskRoutingEngine engine, PrintWriter out) {
        ConsoleOutput.info(out, "Store: " + engine.getStore().getRoot());
        for (TaskStatus status : TaskStatus.values()) {
            out.printf("  %-14s %d%n", status.wireName(), engine.getStore().list(status).size());
        }

        List<Task> waiting = engine.getStore().list(TaskStatus.NEEDS_ACTION);
        if (!waiting.isEmpty()) {
            out.println();
            out.printf("  %-40s %-10s %s%n", "AWAITING APPROVAL", "SOURCE", "TITLE");
            out.println("  " + "-".repeat(72));
            for (Task task : waiting) {
                out.printf("  %-40s %-10s %s%n", task.getId(), task.getSource().wireName(),
                    ConsoleOutput.truncate(task.getTitle(), 30));
            }
        }
        return 0;
    }

    private int task(TaskRoutingEngine engine, PrintWriter out) {
        Optional<Task> found = engine.getStore().get(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error(out, "Task not found: " + taskId);
            return 1;
        }
        Task task = found.get();
        out.println("TASK " + task.getId());
        out.println("Title: " + task.getTitle());
        out.println("Status: " + task.getStatus().wireName());
        out.println("Source: " + task.getSource().wireName());
        out.println("Domain: " + (task.getDomain() != null ? task.getDomain().wireName() : "-")
            + " | Intent: " + (task.getIntent() != null ? task.getIntent() : "-")
            + " | Priority: " + (task.getPriority() != null ? task.getPriority().wireName() : "-"));
        out.println("Attempts: " + task.getRetryCount() + " | Iterations: " + task.getIterationCount());
        task.getFailureReason().ifPresent(reason -> ConsoleOutput.error(out, "Failure: " + reason));

        List<AuditEntry> trail = engine.getAuditLog().readForTask(taskId);
        if (!trail.isEmpty()) {
            out.println();
            for (AuditEntry entry : trail) {
                out.printf("  %s %-18s %s%n", entry.getTimestamp(), entry.getEventType().wireName(), entry.getDetail());
            }
        }
        return 0;
    }
}
