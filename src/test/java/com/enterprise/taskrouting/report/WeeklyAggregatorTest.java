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

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WeeklyAggregatorTest {

    private static final Instant WRITTEN = Instant.parse("2026-03-01T09:00:00Z");
    private static final Instant REPORT_TIME = Instant.parse("2026-03-05T09:00:00Z");

    @TempDir
    Path root;

    private FileTaskStore store;
    private JsonLinesAuditLog auditLog;
    private WeeklyAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new FileTaskStore(root.resolve("tasks"), Clock.fixed(WRITTEN, ZoneOffset.UTC));
        auditLog = new JsonLinesAuditLog(root.resolve("audit.jsonl"), Clock.fixed(REPORT_TIME.minusSeconds(3600), ZoneOffset.UTC));
        aggregator = new WeeklyAggregator(store, auditLog, Duration.ofHours(48), Clock.fixed(REPORT_TIME, ZoneOffset.UTC));
    }

    @Test
    void testCountsAndStaleTasks() throws Exception {
        for (int i = 0; i < 10; i++) {
            Task task = store.enqueue(newTask(Source.LINKEDIN, "Completed task " + i, WRITTEN));
            store.claim(task.getId());
            store.complete(task.getId());
        }
        for (int i = 0; i < 2; i++) {
            Task task = store.enqueue(newTask(Source.GMAIL, "Blocked on vendor " + i, WRITTEN));
            store.fail(task.getId(), "action_failed: 403");
        }
        List<String> waitingIds = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Task task = store.enqueue(newTask(Source.WHATSAPP, "Hello " + i, WRITTEN));
            store.awaitApproval(task.getId(), t -> t.toBuilder().requiresApproval(true).build());
            waitingIds.add(task.getId());
        }
        Task old = store.enqueue(newTask(Source.LINKEDIN, "Ancient", Instant.parse("2026-01-01T00:00:00Z")));
        store.claim(old.getId());
        store.complete(old.getId());

        WeeklySummary summary = aggregator.aggregate(ReportWindow.parse("weekly"));

        assertEquals(10, summary.getCount(TaskStatus.DONE));
        assertEquals(2, summary.getCount(TaskStatus.FAILED));
        assertEquals(3, summary.getCount(TaskStatus.NEEDS_ACTION));
        assertEquals(0, summary.getCount(TaskStatus.NEW));
        assertEquals(15, summary.getTotalTasks());
        assertEquals(waitingIds.stream().sorted().collect(Collectors.toList()),
            summary.getStaleTaskIds().stream().sorted().collect(Collectors.toList()));

        assertEquals(Map.of(WeeklyAggregator.UNCLASSIFIED, 15L), summary.getDomainCounts());
        assertEquals(10L, summary.getSourceCounts().get(Source.LINKEDIN));
        assertEquals(2L, summary.getSourceCounts().get(Source.GMAIL));
        assertEquals(3L, summary.getSourceCounts().get(Source.WHATSAPP));
        assertEquals(2, summary.getCategories().get(ContentCategory.BOTTLENECKS).size());
        assertEquals(10, summary.getCategories().get(ContentCategory.TASKS).size());

        assertEquals(List.of(
            "Priority: address 2 bottleneck(s)",
            "Approvals: 3 task(s) waiting longer than 48h",
            "Failures: review 2 failed task(s)",
            "Progress: 10 tasks completed this period"), summary.getRecommendations());
        assertEquals(REPORT_TIME, summary.getPeriodEnd());
        assertEquals(REPORT_TIME.minus(Duration.ofDays(7)), summary.getPeriodStart());
    }

    @Test
    void testAggregationDoesNotChangeTasks() throws Exception {
        Task task = store.enqueue(newTask(Source.WHATSAPP, "waiting", WRITTEN));
        store.awaitApproval(task.getId(), t -> t.toBuilder().requiresApproval(true).build());
        Task before = store.get(task.getId()).orElseThrow();

        aggregator.aggregate(ReportWindow.parse("weekly"));

        assertEquals(before, store.get(task.getId()).orElseThrow());
    }

    @Test
    void testFreshApprovalIsNotStale() throws Exception {
        FileTaskStore recentStore = new FileTaskStore(root.resolve("recent"), Clock.fixed(REPORT_TIME.minusSeconds(60), ZoneOffset.UTC));
        Task task = recentStore.enqueue(newTask(Source.WHATSAPP, "just now", REPORT_TIME.minusSeconds(60)));
        recentStore.awaitApproval(task.getId(), t -> t.toBuilder().requiresApproval(true).build());
        WeeklyAggregator recent = new WeeklyAggregator(recentStore, auditLog, Duration.ofHours(48),
            Clock.fixed(REPORT_TIME, ZoneOffset.UTC));

        WeeklySummary summary = recent.aggregate(ReportWindow.parse("daily"));

        assertEquals(1, summary.getCount(TaskStatus.NEEDS_ACTION));
        assertTrue(summary.getStaleTaskIds().isEmpty());
    }

    @Test
    void testAuditEventsCountedInsideWindowOnly() {
        auditLog.record("a", AuditEventType.SUCCESS, "", TaskStatus.DONE);
        auditLog.record("b", AuditEventType.SUCCESS, "", TaskStatus.DONE);
        auditLog.append(new AuditEntry(REPORT_TIME.minus(Duration.ofDays(10)), "c", AuditEventType.FAILURE, "", TaskStatus.FAILED));

        WeeklySummary summary = aggregator.aggregate(ReportWindow.parse("weekly"));

        assertEquals(Map.of(AuditEventType.SUCCESS, 2L), summary.getAuditEventCounts());
    }

    @Test
    void testEmptyStoreIsHealthy() {
        WeeklySummary summary = aggregator.aggregate(ReportWindow.parse("weekly"));

        assertEquals(0, summary.getTotalTasks());
        assertEquals(List.of("All systems operating normally"), summary.getRecommendations());
    }

    private static Task newTask(Source source, String title, Instant createdAt) {
        return TaskImpl.builder()
            .source(source)
            .title(title)
            .status(TaskStatus.NEW)
            .payload(Payload.ofBody(title))
            .createdAt(createdAt)
            .build();
    }
}
