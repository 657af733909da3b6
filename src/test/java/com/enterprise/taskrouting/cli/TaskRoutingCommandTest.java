package com.enterprise.taskrouting.cli;

import com.enterprise.taskrouting.TaskRoutingEngineFactory;
import com.enterprise.taskrouting.config.ConfigLoader;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.store.FileTaskStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskRoutingCommandTest {

    @TempDir
    Path home;

    private String output;

    @Test
    void testNoSubcommandPrintsUsage() {
        assertEquals(0, execute());
        assertTrue(output.contains("Usage: task-routing"));
        assertTrue(output.contains("approve"));
        assertTrue(output.contains("report"));
    }

    @Test
    void testStatusOfEmptyStore() {
        assertEquals(0, execute("status"));
        assertTrue(output.contains("Store: " + home));
        assertTrue(output.contains("needs_action"));
        assertFalse(output.contains("AWAITING APPROVAL"));
    }

    @Test
    void testApproveUnknownTask() {
        assertEquals(1, execute("approve", "20260101_000000_gmail_abcdef"));
        assertTrue(output.contains("Task not found: 20260101_000000_gmail_abcdef"));
    }

    @Test
    void testProcessApproveAndInspect() throws Exception {
        Task task = new FileTaskStore(home, Clock.systemUTC()).enqueue(TaskImpl.builder()
            .source(Source.GMAIL)
            .title("Pay the bank invoice")
            .status(TaskStatus.NEW)
            .payload(Payload.ofBody("Pay the bank invoice before Friday."))
            .createdAt(Instant.now())
            .build());

        assertEquals(0, execute("process"));
        assertTrue(output.contains("Awaiting approval: 1"));

        assertEquals(0, execute("status"));
        assertTrue(output.contains("AWAITING APPROVAL"));
        assertTrue(output.contains(task.getId()));

        assertEquals(0, execute("approve", task.getId(), "--process"));
        assertTrue(output.contains("Approved " + task.getId()));
        assertTrue(output.contains("is now done"));

        assertEquals(0, execute("status", task.getId()));
        assertTrue(output.contains("Status: done"));
        assertTrue(output.contains("approval_requested"));
        assertTrue(output.contains("approval_granted"));
        assertTrue(output.contains("success"));

        assertEquals(1, execute("deny", task.getId()));
        assertTrue(output.contains("is not awaiting approval"));
    }

    @Test
    void testDenyFailsTask() throws Exception {
        Task task = new FileTaskStore(home, Clock.systemUTC()).enqueue(TaskImpl.builder()
            .source(Source.GMAIL)
            .title("Send the contract password")
            .status(TaskStatus.NEW)
            .payload(Payload.ofBody("Send the contract password."))
            .createdAt(Instant.now())
            .build());
        execute("process");

        assertEquals(0, execute("deny", task.getId()));
        assertTrue(output.contains("Denied " + task.getId()));

        execute("status", task.getId());
        assertTrue(output.contains("Status: failed"));
        assertTrue(output.contains("approval_denied"));
    }

    @Test
    void testReportWritesBriefing() throws Exception {
        assertEquals(0, execute("report", "daily"));
        assertTrue(output.contains("Briefing written to"));

        List<Path> briefings = new ArrayList<>();
        try (var files = Files.list(home.resolve("briefings"))) {
            files.forEach(briefings::add);
        }
        assertEquals(1, briefings.size());
        assertTrue(briefings.get(0).getFileName().toString().endsWith("_daily_briefing.md"));
    }

    @Test
    void testReportRejectsUnknownWindow() {
        assertEquals(2, execute("report", "fortnightly"));
        assertTrue(output.contains("Unknown report window"));
    }

    private int execute(String... args) {
        List<String> arguments = new ArrayList<>(List.of("--home", home.toString()));
        arguments.addAll(List.of(args));
        StringWriter sw = new StringWriter();
        CommandLine cmd = new CommandLine(new TaskRoutingCommand(new ConfigLoader(Map.of()), TaskRoutingEngineFactory::create));
        cmd.setOut(new PrintWriter(sw));
        int exitCode = cmd.execute(arguments.toArray(new String[0]));
        output = sw.toString();
        return exitCode;
    }
}
