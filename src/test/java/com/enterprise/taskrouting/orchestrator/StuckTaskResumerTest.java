package com.enterprise.taskrouting.orchestrator;

import com.enterprise.taskrouting.audit.AuditEntry;
import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.JsonLinesAuditLog;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.monitoring.MetricsCollector;
import com.enterprise.taskrouting.store.FileTaskStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StuckTaskResumerTest {

    private static final Instant CLAIMED_AT = Instant.parse("2026-03-02T09:00:00Z");

    @TempDir
    Path root;

    private FileTaskStore store;
    private JsonLinesAuditLog auditLog;
    private MetricsCollector metricsCollector;
    private StuckTaskResumer resumer;

    @BeforeEach
    void setUp() {
        store = new FileTaskStore(root.resolve("tasks"), Clock.fixed(CLAIMED_AT, ZoneOffset.UTC));
        auditLog = new JsonLinesAuditLog(root.resolve("audit.jsonl"), Clock.fixed(CLAIMED_AT, ZoneOffset.UTC));
        metricsCollector = new MetricsCollector(new SimpleMeterRegistry());
        resumer = new StuckTaskResumer(store, auditLog, metricsCollector,
            Clock.fixed(CLAIMED_AT.plus(Duration.ofHours(1)), ZoneOffset.UTC),
            Duration.ofMinutes(30), Duration.ofMinutes(1));
    }

    @Test
    void testStuckTasksReturnToResumablePartition() throws Exception {
        Task plain = claimed("Weekly update");
        Task approved = store.enqueue(newTask("Invoice reminder"));
        store.awaitApproval(approved.getId(), t -> t.toBuilder().requiresApproval(true).build());
        store.update(approved.getId(), TaskStatus.NEEDS_ACTION, t -> t.toBuilder().approved(Boolean.TRUE).build());
        store.claim(approved.getId());

        assertEquals(2, resumer.resume(id -> false));

        assertEquals(TaskStatus.NEW, store.get(plain.getId()).orElseThrow().getStatus());
        Task waiting = store.get(approved.getId()).orElseThrow();
        assertEquals(TaskStatus.NEEDS_ACTION, waiting.getStatus());
        assertEquals(Boolean.TRUE, waiting.getApproved());

        AuditEntry moved = auditLog.readForTask(plain.getId()).get(0);
        assertEquals(AuditEventType.MOVED, moved.getEventType());
        assertEquals("stuck in in_progress since 2026-03-02T09:00:00Z, requeued to new", moved.getDetail());
        assertEquals(TaskStatus.NEW, moved.getStatusAfter());
        assertEquals(2.0, metricsCollector.getMetrics().get("tasks.resumed"));
    }

    @Test
    void testRecentAndLocallyHeldTasksAreLeftAlone() throws Exception {
        Task held = claimed("Held by a local worker");
        FileTaskStore laterWriter = new FileTaskStore(root.resolve("tasks"),
            Clock.fixed(CLAIMED_AT.plus(Duration.ofMinutes(50)), ZoneOffset.UTC));
        Task recent = laterWriter.enqueue(newTask("Still running elsewhere"));
        laterWriter.claim(recent.getId());

        assertEquals(0, resumer.resume(Set.of(held.getId())::contains));

        assertEquals(TaskStatus.IN_PROGRESS, store.get(held.getId()).orElseThrow().getStatus());
        assertEquals(TaskStatus.IN_PROGRESS, store.get(recent.getId()).orElseThrow().getStatus());
        assertTrue(auditLog.readAll().isEmpty());
    }

    @Test
    void testResolvesOldStagingFilesOnly() throws Exception {
        Path done = store.getPartition(TaskStatus.DONE);
        Path abandoned = done.resolve(".abandoned.md.tmp");
        Path fresh = done.resolve(".fresh.md.tmp");
        Files.writeString(abandoned, "partial");
        Files.writeString(fresh, "partial");
        Files.setLastModifiedTime(abandoned, FileTime.from(Instant.now().minus(Duration.ofMinutes(10))));

        assertEquals(0, resumer.resume(id -> false));

        assertFalse(Files.exists(abandoned));
        assertTrue(Files.exists(fresh));
        assertEquals(List.of(), store.list(TaskStatus.DONE));
    }

    private Task claimed(String title) throws Exception {
        Task stored = store.enqueue(newTask(title));
        return store.claim(stored.getId());
    }

    private static Task newTask(String title) {
        return TaskImpl.builder()
            .source(Source.INBOX)
            .title(title)
            .status(TaskStatus.NEW)
            .payload(Payload.ofBody(title))
            .createdAt(CLAIMED_AT)
            .build();
    }
}
