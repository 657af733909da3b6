package com.enterprise.taskrouting.report;

import com.enterprise.taskrouting.audit.AuditEntry;
import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.JsonLinesAuditLog;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.store.FileTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-08T08:00:00Z");

    @TempDir
    Path root;

    private FileTaskStore store;
    private JsonLinesAuditLog auditLog;
    private ReportService reportService;
    private Path briefings;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new FileTaskStore(root.resolve("tasks"), Clock.fixed(NOW.minus(Duration.ofDays(3)), ZoneOffset.UTC));
        auditLog = new JsonLinesAuditLog(root.resolve("audit.jsonl"), clock);
        briefings = root.resolve("briefings");
        reportService = new ReportService(
            new WeeklyAggregator(store, auditLog, Duration.ofHours(48), clock),
            new BriefingRenderer(ZoneOffset.UTC),
            auditLog,
            briefings);
    }

    @Test
    void testGenerateWritesBriefingAndAudits() throws Exception {
        Task waiting = store.enqueue(newTask("Invoice payment from client"));
        store.awaitApproval(waiting.getId(), t -> t.toBuilder().requiresApproval(true).build());
        Task failed = store.enqueue(newTask("Upload stuck"));
        store.fail(failed.getId(), "iteration_cap_exceeded");

        Path briefing = reportService.generate(ReportWindow.parse("weekly"));

        assertEquals(briefings.resolve("20260308_080000_weekly_briefing.md"), briefing);
        String content = Files.readString(briefing, StandardCharsets.UTF_8);
        assertTrue(content.startsWith("---\n"));
        assertTrue(content.contains("type: \"briefing\"") || content.contains("type: briefing"));
        assertTrue(content.contains("total_tasks: 2"));
        assertTrue(content.contains("stale_needs_action: 1"));
        assertTrue(content.contains("# Briefing: weekly"));
        assertTrue(content.contains("**Period:** 2026-03-01 to 2026-03-08"));
        assertTrue(content.contains("- **needs_action:** 1"));
        assertTrue(content.contains("- " + waiting.getId()));
        assertTrue(content.contains("## Revenue\n\n**Items:** 1"));
        assertTrue(content.contains("## Bottlenecks\n\n**Items:** 1"));
        assertTrue(content.contains("- Failures: review 1 failed task(s)"));

        List<AuditEntry> entries = auditLog.readAll();
        assertEquals(1, entries.size());
        AuditEntry entry = entries.get(0);
        assertEquals(AuditEventType.REPORT_GENERATED, entry.getEventType());
        assertEquals("20260308_080000_weekly_briefing.md", entry.getTaskId());
        assertEquals("weekly briefing: 2 tasks, 1 stale", entry.getDetail());
        assertNull(entry.getStatusAfter());
    }

    @Test
    void testEmptyBriefing() throws Exception {
        Path briefing = reportService.generate(ReportWindow.parse("daily"));

        String content = Files.readString(briefing, StandardCharsets.UTF_8);
        assertTrue(briefing.getFileName().toString().endsWith("_daily_briefing.md"));
        assertTrue(content.contains("*No tasks waiting past the staleness threshold.*"));
        assertTrue(content.contains("*No revenue items identified.*"));
        assertTrue(content.contains("- All systems operating normally"));
        try (var files = Files.list(briefings)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testCustomWindowFileName() {
        WeeklySummary summary = WeeklySummary.builder()
            .window(ReportWindow.parse("P14D"))
            .period(NOW.minus(Duration.ofDays(14)), NOW)
            .build();

        assertEquals("20260308_080000_p14d_briefing.md", new BriefingRenderer(ZoneOffset.UTC).fileName(summary));
    }

    private static Task newTask(String title) {
        return TaskImpl.builder()
            .source(Source.GMAIL)
            .title(title)
            .status(TaskStatus.NEW)
            .payload(Payload.ofBody(title))
            .createdAt(NOW.minus(Duration.ofDays(3)))
            .build();
    }
}
