package com.enterprise.taskrouting.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI command: task-routing deny &lt;task-id&gt;
 */
@Command(name = "deny", mixinStandardHelpOptions = true,
        description = "Deny a task awaiting approval; it fails with reason approval_denied")
public class DenyCommand implements Callable<Integer> {

    @ParentCommand
    private TaskRoutingCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Override
    public Integer call() {
        return DecisionSupport.decide(parent, spec, taskId, false, false);
    }
}
