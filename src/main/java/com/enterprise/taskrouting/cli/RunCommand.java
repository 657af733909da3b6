package com.enterprise.taskrouting.cli;

import com.enterprise.taskrouting.TaskRoutingEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * CLI command: task-routing run
 * <p>
 * Polls intake on a fixed delay and runs the scheduled briefing until the
 * process is stopped; in-flight tasks are requeued on shutdown.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the routing daemon")
public class RunCommand implements Callable<Integer> {

    @ParentCommand
    private TaskRoutingCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws InterruptedException {
        TaskRoutingEngine engine = parent.engine();
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            engine.stop();
            stopped.countDown();
        }, "task-routing-shutdown"));

        engine.start();
        ConsoleOutput.info(spec.commandLine().getOut(), "Routing tasks under " + engine.getStore().getRoot()
            + " (Ctrl+C to stop)");
        stopped.await();
        return 0;
    }
}
