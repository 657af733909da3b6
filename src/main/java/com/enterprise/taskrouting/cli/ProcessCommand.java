package com.enterprise.taskrouting.cli;

import com.enterprise.taskrouting.orchestrator.PassSummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * CLI command: task-routing process
 */
@Command(name = "process", mixinStandardHelpOptions = true,
        description = "Run a single intake and processing pass, then exit")
public class ProcessCommand implements Callable<Integer> {

    @ParentCommand
    private TaskRoutingCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            PassSummary summary = parent.engine().getOrchestrator().processPending();
            ConsoleOutput.info(out, "Dispatched " + summary.getDispatched() + " task(s)");
            ConsoleOutput.success(out, "Completed: " + summary.getCompleted());
            if (summary.getFailed() > 0) {
                ConsoleOutput.error(out, "Failed: " + summary.getFailed());
            }
            ConsoleOutput.info(out, "Awaiting approval: " + summary.getAwaitingApproval());
            return 0;
        } finally {
            parent.close();
        }
    }
}
