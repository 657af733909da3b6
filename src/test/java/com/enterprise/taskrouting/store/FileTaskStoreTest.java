package com.enterprise.taskrouting.store;

import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.DuplicateTaskException;
import com.enterprise.taskrouting.exception.IllegalTransitionException;
import com.enterprise.taskrouting.exception.TaskNotClaimableException;
import com.enterprise.taskrouting.exception.TaskNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileTaskStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @TempDir
    Path root;

    private Clock clock;
    private FileTaskStore store;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new FileTaskStore(root, clock);
    }

    @Test
    void testPartitionsCreated() {
        for (TaskStatus status : TaskStatus.values()) {
            assertTrue(Files.isDirectory(root.resolve(status.wireName())), status.wireName());
        }
    }

    @Test
    void testEnqueueAssignsIdAndWritesDocument() throws Exception {
        Task stored = store.enqueue(newTask(Source.GMAIL, "Launch post"));

        assertNotNull(stored.getId());
        assertTrue(stored.getId().startsWith("20260302_090000_gmail_"));
        assertEquals(TaskStatus.NEW, stored.getStatus());
        assertTrue(Files.exists(store.getPartition(TaskStatus.NEW)
            .resolve(TaskIdGenerator.fileName(stored.getId(), "Launch post"))));
        assertEquals(stored.getId(), store.get(stored.getId()).orElseThrow().getId());
    }

    @Test
    void testDuplicateEnqueueRejected() throws Exception {
        Task stored = store.enqueue(newTask(Source.GMAIL, "first"));

        Task duplicate = newTask(Source.GMAIL, "second").toBuilder().id(stored.getId()).build();
        assertThrows(DuplicateTaskException.class, () -> store.enqueue(duplicate));
    }

    @Test
    void testInvalidIdRejected() {
        Task task = newTask(Source.GMAIL, "bad").toBuilder().id("../outside").build();

        assertThrows(IllegalArgumentException.class, () -> store.enqueue(task));
    }

    @Test
    void testClaimMovesTaskToInProgress() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "claim me"));

        Task claimed = store.claim(stored.getId());

        assertEquals(TaskStatus.IN_PROGRESS, claimed.getStatus());
        assertTrue(store.list(TaskStatus.NEW).isEmpty());
        assertEquals(1, store.list(TaskStatus.IN_PROGRESS).size());
        assertThrows(TaskNotClaimableException.class, () -> store.claim(stored.getId()));
    }

    @Test
    void testClaimUnknownTask() {
        assertThrows(TaskNotFoundException.class, () -> store.claim("20260302_090000_gmail_000000"));
        assertTrue(store.get("20260302_090000_gmail_000000").isEmpty());
    }

    @Test
    void testClaimRequiresApproval() throws Exception {
        Task stored = store.enqueue(newTask(Source.LINKEDIN, "needs a human"));
        store.awaitApproval(stored.getId(), t -> t.toBuilder().requiresApproval(true).build());

        TaskNotClaimableException e = assertThrows(TaskNotClaimableException.class,
            () -> store.claim(stored.getId()));
        assertTrue(e.getMessage().contains("approval"));

        store.update(stored.getId(), TaskStatus.NEEDS_ACTION, t -> t.toBuilder().approved(Boolean.TRUE).build());
        Task claimed = store.claim(stored.getId());

        assertEquals(TaskStatus.IN_PROGRESS, claimed.getStatus());
        assertEquals(Boolean.TRUE, claimed.getApproved());
    }

    @Test
    void testClaimResetsRetryCount() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "retry").toBuilder().retryCount(3).build());

        assertEquals(0, store.claim(stored.getId()).getRetryCount());
    }

    @Test
    void testCompleteOnlyFromInProgress() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "complete me"));

        assertThrows(IllegalTransitionException.class, () -> store.complete(stored.getId()));

        store.claim(stored.getId());
        Task done = store.complete(stored.getId());

        assertEquals(TaskStatus.DONE, done.getStatus());
        assertEquals(1, store.list(TaskStatus.DONE).size());
        assertThrows(IllegalTransitionException.class, () -> store.fail(stored.getId(), "too late"));
    }

    @Test
    void testFailRecordsReason() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "fail me"));

        Task failed = store.fail(stored.getId(), "approval_denied");

        assertEquals(TaskStatus.FAILED, failed.getStatus());
        Task reloaded = store.get(stored.getId()).orElseThrow();
        assertEquals(TaskStatus.FAILED, reloaded.getStatus());
        assertEquals("approval_denied", reloaded.getFailureReason().orElse(null));
    }

    @Test
    void testUpdateChecksExpectedStatus() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "update me"));

        assertThrows(IllegalTransitionException.class,
            () -> store.update(stored.getId(), TaskStatus.IN_PROGRESS, t -> t));

        Task updated = store.update(stored.getId(), TaskStatus.NEW, t -> t.toBuilder().intent("post").build());
        assertEquals("post", updated.getIntent());
        assertEquals("post", store.get(stored.getId()).orElseThrow().getIntent());
    }

    @Test
    void testRequeueReturnsToEntryPartition() throws Exception {
        Task plain = store.enqueue(newTask(Source.INBOX, "plain"));
        Task gated = store.enqueue(newTask(Source.INBOX, "gated"));
        store.awaitApproval(gated.getId(), t -> t.toBuilder().requiresApproval(true).build());
        store.update(gated.getId(), TaskStatus.NEEDS_ACTION, t -> t.toBuilder().approved(Boolean.TRUE).build());

        store.claim(plain.getId());
        store.claim(gated.getId());

        assertEquals(TaskStatus.NEW, store.requeue(plain.getId()).getStatus());
        assertEquals(TaskStatus.NEEDS_ACTION, store.requeue(gated.getId()).getStatus());
        assertThrows(IllegalTransitionException.class, () -> store.requeue(plain.getId()));
    }

    @Test
    void testListAllCoversEveryPartition() throws Exception {
        Task a = store.enqueue(newTask(Source.INBOX, "a"));
        Task b = store.enqueue(newTask(Source.INBOX, "b"));
        store.enqueue(newTask(Source.INBOX, "c"));
        store.claim(a.getId());
        store.fail(b.getId(), "nope");

        assertEquals(3, store.listAll().size());
        assertEquals(1, store.list(TaskStatus.NEW).size());
        assertEquals(1, store.list(TaskStatus.IN_PROGRESS).size());
        assertEquals(1, store.list(TaskStatus.FAILED).size());
    }

    @Test
    void testScanIntakeRegistersProducerDocument() throws Exception {
        Path dropped = store.getPartition(TaskStatus.NEW).resolve("whatsapp_message.md");
        Files.writeString(dropped, "---\nsource: whatsapp\nstatus: pending\n---\n\nDinner on Sunday?\n",
            StandardCharsets.UTF_8);

        List<IntakeItem> first = store.scanIntake();

        assertEquals(1, first.size());
        IntakeItem item = first.get(0);
        assertFalse(item.isRejected());
        assertTrue(item.isNewlyRegistered());
        Task task = item.getTask().orElseThrow();
        assertEquals(Source.WHATSAPP, task.getSource());
        assertTrue(TaskIdGenerator.isValidId(task.getId()));
        assertFalse(Files.exists(dropped));
        assertTrue(Files.exists(item.getPath()));

        List<IntakeItem> second = store.scanIntake();
        assertEquals(1, second.size());
        assertFalse(second.get(0).isNewlyRegistered());
        assertEquals(task.getId(), second.get(0).getTask().orElseThrow().getId());
    }

    @Test
    void testScanIntakeRejectsMalformedDocumentAndQuarantines() throws Exception {
        Path dropped = store.getPartition(TaskStatus.NEW).resolve("broken.md");
        Files.writeString(dropped, "no header here\n", StandardCharsets.UTF_8);

        List<IntakeItem> items = store.scanIntake();

        assertEquals(1, items.size());
        assertTrue(items.get(0).isRejected());
        assertTrue(items.get(0).getError().isPresent());

        Task quarantined = store.quarantine(items.get(0).getPath(), items.get(0).getError().get());

        assertEquals(TaskStatus.FAILED, quarantined.getStatus());
        assertFalse(Files.exists(dropped));
        Task reloaded = store.get(quarantined.getId()).orElseThrow();
        assertEquals(TaskStatus.FAILED, reloaded.getStatus());
        assertEquals("broken.md", reloaded.getPayload().field("original_file").orElse(null));
        assertTrue(reloaded.getPayload().getBody().contains("no header here"));
        assertTrue(store.scanIntake().isEmpty());
    }

    @Test
    void testScanIntakeRejectsDuplicateId() throws Exception {
        Task stored = store.enqueue(newTask(Source.GMAIL, "original"));
        Path copy = store.getPartition(TaskStatus.NEW).resolve("copy.md");
        Files.writeString(copy, "---\nid: " + stored.getId() + "\nsource: gmail\n---\nA copy\n", StandardCharsets.UTF_8);

        List<IntakeItem> rejected = store.scanIntake().stream()
            .filter(IntakeItem::isRejected)
            .collect(Collectors.toList());

        assertEquals(1, rejected.size());
        assertEquals(copy, rejected.get(0).getPath());
        assertTrue(rejected.get(0).getError().orElse("").contains("duplicate"));
    }

    @Test
    void testRecoveryRestoresInterruptedTransition() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "interrupted"));
        String fileName = TaskIdGenerator.fileName(stored.getId(), stored.getTitle());
        Path staged = store.getPartition(TaskStatus.IN_PROGRESS).resolve("." + fileName + FileTaskStore.PENDING_SUFFIX);
        Files.move(store.getPartition(TaskStatus.NEW).resolve(fileName), staged, StandardCopyOption.ATOMIC_MOVE);
        Path partial = store.getPartition(TaskStatus.DONE).resolve(".leftover.md" + FileTaskStore.TMP_SUFFIX);
        Files.writeString(partial, "partial");

        assertEquals(2, store.recover(Duration.ZERO));

        assertFalse(Files.exists(staged));
        assertFalse(Files.exists(partial));
        assertEquals(TaskStatus.NEW, store.get(stored.getId()).orElseThrow().getStatus());
        try (Stream<Path> done = Files.list(store.getPartition(TaskStatus.DONE))) {
            assertEquals(0, done.count());
        }
    }

    @Test
    void testRecoveryCompletesCommittedTransition() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "committed"));
        store.claim(stored.getId());
        String fileName = TaskIdGenerator.fileName(stored.getId(), stored.getTitle());
        Path leftover = store.getPartition(TaskStatus.IN_PROGRESS).resolve("." + fileName + FileTaskStore.PENDING_SUFFIX);
        Files.writeString(leftover, "stale copy");

        assertEquals(1, store.recover(Duration.ZERO));

        assertFalse(Files.exists(leftover));
        assertEquals(TaskStatus.IN_PROGRESS, store.get(stored.getId()).orElseThrow().getStatus());
    }

    @Test
    void testOpeningStoreLeavesInFlightTransitionAlone() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "mid-claim"));
        String fileName = TaskIdGenerator.fileName(stored.getId(), stored.getTitle());
        Path staged = store.getPartition(TaskStatus.IN_PROGRESS).resolve("." + fileName + FileTaskStore.PENDING_SUFFIX);
        // another process has staged the claim but not yet written the in_progress document
        Files.move(store.getPartition(TaskStatus.NEW).resolve(fileName), staged, StandardCopyOption.ATOMIC_MOVE);
        Files.setLastModifiedTime(staged, FileTime.from(Instant.now()));

        FileTaskStore reader = new FileTaskStore(root, clock);
        reader.listAll();

        assertTrue(Files.exists(staged));
        assertFalse(Files.exists(store.getPartition(TaskStatus.NEW).resolve(fileName)));

        assertEquals(0, reader.recover(Duration.ofMinutes(1)));
        assertTrue(Files.exists(staged));

        Files.setLastModifiedTime(staged, FileTime.from(Instant.now().minus(Duration.ofMinutes(5))));
        assertEquals(1, reader.recover(Duration.ofMinutes(1)));
        assertFalse(Files.exists(staged));
        assertEquals(TaskStatus.NEW, reader.get(stored.getId()).orElseThrow().getStatus());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testConcurrentClaimHasSingleWinner() throws Exception {
        Task stored = store.enqueue(newTask(Source.INBOX, "contended"));
        FileTaskStore otherProcess = new FileTaskStore(root, clock);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(threads);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger losers = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            TaskStore contender = i % 2 == 0 ? store : otherProcess;
            executor.submit(() -> {
                try {
                    start.await();
                    contender.claim(stored.getId());
                    winners.incrementAndGet();
                } catch (TaskNotClaimableException | TaskNotFoundException e) {
                    losers.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    finished.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(finished.await(20, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, winners.get());
        assertEquals(threads - 1, losers.get());
        assertEquals(TaskStatus.IN_PROGRESS, store.get(stored.getId()).orElseThrow().getStatus());
    }

    private Task newTask(Source source, String title) {
        return TaskImpl.builder()
            .source(source)
            .title(title)
            .status(TaskStatus.NEW)
            .payload(new Payload("body of " + title, Map.of()))
            .createdAt(NOW)
            .build();
    }
}
