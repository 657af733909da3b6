package com.enterprise.taskrouting.cli;

import com.enterprise.taskrouting.TaskRoutingEngine;
import com.enterprise.taskrouting.TaskRoutingEngineFactory;
import com.enterprise.taskrouting.config.ConfigLoader;
import com.enterprise.taskrouting.config.RoutingConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Top-level CLI command.
 * Routes to subcommands: run, process, approve, deny, report, status.
 */
@Command(
        name = "task-routing",
        mixinStandardHelpOptions = true,
        version = "task-routing 1.0.0",
        description = "Routes producer tasks through classification, approval and execution",
        subcommands = {
                RunCommand.class,
                ProcessCommand.class,
                ApproveCommand.class,
                DenyCommand.class,
                ReportCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class TaskRoutingCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: bundled task-routing.yml)")
    private Path configFile;

    @Option(names = {"--home"}, description = "Store root, overrides the configuration and TASKROUTING_HOME")
    private Path home;

    private final ConfigLoader configLoader;
    private final Function<RoutingConfig, TaskRoutingEngine> engineFactory;
    private TaskRoutingEngine engine;

    public TaskRoutingCommand() {
        this(new ConfigLoader(), TaskRoutingEngineFactory::create);
    }

    public TaskRoutingCommand(ConfigLoader configLoader, Function<RoutingConfig, TaskRoutingEngine> engineFactory) {
        this.configLoader = configLoader;
        this.engineFactory = engineFactory;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new TaskRoutingCommand()).execute(args));
    }

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Loads the configuration and wires the engine on first use
     */
    TaskRoutingEngine engine() {
        if (engine == null) {
            RoutingConfig config = configLoader.load(configFile);
            if (home != null) {
                config = RoutingConfig.builder()
                    .storeConfig(config.getStoreConfig())
                    .retryConfig(config.getRetryConfig())
                    .loopConfig(config.getLoopConfig())
                    .executorConfig(config.getExecutorConfig())
                    .approvalConfig(config.getApprovalConfig())
                    .reportConfig(config.getReportConfig())
                    .classifierConfig(config.getClassifierConfig())
                    .actionConfig(config.getActionConfig())
                    .root(home)
                    .build();
            }
            engine = engineFactory.apply(config);
        }
        return engine;
    }

    /**
     * Releases worker threads after a one-shot command
     */
    void close() {
        if (engine != null) {
            engine.stop();
        }
    }
}
