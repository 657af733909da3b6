package com.enterprise.taskrouting.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI command: task-routing approve &lt;task-id&gt;
 */
@Command(name = "approve", mixinStandardHelpOptions = true, description = "Approve a task awaiting approval")
public class ApproveCommand implements Callable<Integer> {

    @ParentCommand
    private TaskRoutingCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--process", "-p"}, description = "Run a processing pass right away")
    private boolean process;

    @Override
    public Integer call() {
        return DecisionSupport.decide(parent, spec, taskId, true, process);
    }
}
