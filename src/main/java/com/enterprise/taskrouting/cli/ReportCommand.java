package com.enterprise.taskrouting.cli;

import com.enterprise.taskrouting.TaskRoutingEngine;
import com.enterprise.taskrouting.report.ReportWindow;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: task-routing report [window]
 */
@Command(name = "report", mixinStandardHelpOptions = true,
        description = "Write a briefing for a window: daily, weekly, monthly, <n>d, <n>h or ISO-8601")
public class ReportCommand implements Callable<Integer> {

    @ParentCommand
    private TaskRoutingCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Window (default: configured report window)")
    private String window;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            TaskRoutingEngine engine = parent.engine();
            String value = window != null ? window : engine.getConfig().getReportConfig().getDefaultWindow();
            ReportWindow reportWindow;
            try {
                reportWindow = ReportWindow.parse(value);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(out, e.getMessage());
                return 2;
            }
            Path briefing = engine.getReportService().generate(reportWindow);
            ConsoleOutput.success(out, "Briefing written to " + briefing);
            return 0;
        } finally {
            parent.close();
        }
    }
}
