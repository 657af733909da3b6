package com.enterprise.taskrouting.cli;

import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * ANSI-colored terminal output for the task-routing CLI
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(PrintWriter out, String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [task-routing]|@ " + message));
    }

    public static void success(PrintWriter out, String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void error(PrintWriter out, String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
