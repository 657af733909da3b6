package com.enterprise.taskrouting.store;

import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.DuplicateTaskException;
import com.enterprise.taskrouting.exception.IllegalTransitionException;
import com.enterprise.taskrouting.exception.InvalidTaskDocumentException;
import com.enterprise.taskrouting.exception.TaskNotClaimableException;
import com.enterprise.taskrouting.exception.TaskNotFoundException;
import com.enterprise.taskrouting.exception.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Task store backed by one directory per status partition, one markdown
 * document per task.
 * <p>
 * A transition is a three step protocol that survives crashes at any point:
 * <ol>
 *   <li>rename the current document to a hidden {@code .pending} file in the target
 *       partition. The rename is atomic, so when several processes race for the same
 *       document exactly one of them wins;</li>
 *   <li>write the updated document to a hidden {@code .tmp} file and rename it onto the
 *       final name;</li>
 *   <li>delete the {@code .pending} file.</li>
 * </ol>
 * Leftover staging files are resolved by {@link #recover(Duration)}, which only the
 * daemon runs: a {@code .pending} file whose final document exists is deleted,
 * otherwise it is restored to the partition its content belongs to. Opening a store
 * never touches staging files, since they may belong to a transition another
 * process is still running.
 */
public class FileTaskStore implements TaskStore {

    private static final Logger logger = LoggerFactory.getLogger(FileTaskStore.class);

    static final String PENDING_SUFFIX = ".pending";
    static final String TMP_SUFFIX = ".tmp";
    private static final String DOCUMENT_SUFFIX = ".md";
    private static final String ORIGINAL_FILE_FIELD = "original_file";
    private static final int LOCK_STRIPES = 64;

    private final Path root;
    private final Clock clock;
    private final TaskDocumentCodec codec;
    private final TaskIdGenerator idGenerator;
    private final Map<TaskStatus, Path> partitions = new EnumMap<>(TaskStatus.class);
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public FileTaskStore(Path root) {
        this(root, Clock.systemDefaultZone());
    }

    public FileTaskStore(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
        this.codec = new TaskDocumentCodec(clock.getZone());
        this.idGenerator = new TaskIdGenerator(clock.getZone());
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }

        try {
            for (TaskStatus status : TaskStatus.values()) {
                Path partition = root.resolve(status.wireName());
                Files.createDirectories(partition);
                partitions.put(status, partition);
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to create task store partitions under " + root, e);
        }

        logger.info("FileTaskStore initialized at: {}", root);
    }

    @Override
    public Task enqueue(Task task) throws DuplicateTaskException {
        String id = task.getId() != null ? task.getId() : idGenerator.generate(task.getCreatedAt(), task.getSource());
        if (!TaskIdGenerator.isValidId(id)) {
            throw new IllegalArgumentException("Invalid task id: " + id);
        }

        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            if (locate(id).isPresent()) {
                throw new DuplicateTaskException(id);
            }
            Task stored = task.toBuilder()
                .id(id)
                .status(TaskStatus.NEW)
                .updatedAt(clock.instant())
                .build();
            write(stored);
            logger.debug("Task {} enqueued", id);
            return stored;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Task claim(String id) throws TaskNotFoundException, TaskNotClaimableException {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Located current = locate(id).orElseThrow(() -> new TaskNotFoundException(id));
            TaskStatus status = current.task.getStatus();
            if (status != TaskStatus.NEW && status != TaskStatus.NEEDS_ACTION) {
                throw new TaskNotClaimableException(id, status, "only new or needs_action tasks can be claimed");
            }
            if (!current.task.isApprovalSatisfied()) {
                throw new TaskNotClaimableException(id, status, "approval has not been granted");
            }

            Task claimed = current.task.toBuilder()
                .status(TaskStatus.IN_PROGRESS)
                .retryCount(0)
                .updatedAt(clock.instant())
                .build();
            if (!relocate(current.path, claimed)) {
                throw new TaskNotClaimableException(id, null, "claimed concurrently");
            }
            logger.debug("Task {} claimed from {}", id, status.wireName());
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Task complete(String id) throws TaskNotFoundException, IllegalTransitionException {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Located current = locate(id).orElseThrow(() -> new TaskNotFoundException(id));
            requireStatus(current.task, TaskStatus.IN_PROGRESS, TaskStatus.DONE);

            Task done = current.task.toBuilder()
                .status(TaskStatus.DONE)
                .updatedAt(clock.instant())
                .build();
            return commit(current, done);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Task fail(String id, String reason) throws TaskNotFoundException, IllegalTransitionException {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Located current = locate(id).orElseThrow(() -> new TaskNotFoundException(id));
            if (current.task.getStatus().isTerminal()) {
                throw new IllegalTransitionException(id, current.task.getStatus(), TaskStatus.FAILED);
            }

            Task failed = current.task.toBuilder()
                .status(TaskStatus.FAILED)
                .failureReason(reason)
                .updatedAt(clock.instant())
                .build();
            return commit(current, failed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Task awaitApproval(String id, UnaryOperator<Task> mutator)
            throws TaskNotFoundException, IllegalTransitionException {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Located current = locate(id).orElseThrow(() -> new TaskNotFoundException(id));
            requireStatus(current.task, TaskStatus.NEW, TaskStatus.NEEDS_ACTION);

            Task waiting = mutator.apply(current.task).toBuilder()
                .id(id)
                .status(TaskStatus.NEEDS_ACTION)
                .updatedAt(clock.instant())
                .build();
            return commit(current, waiting);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Task update(String id, TaskStatus expectedStatus, UnaryOperator<Task> mutator)
            throws TaskNotFoundException, IllegalTransitionException {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Located current = locate(id).orElseThrow(() -> new TaskNotFoundException(id));
            requireStatus(current.task, expectedStatus, expectedStatus);

            Task updated = mutator.apply(current.task).toBuilder()
                .id(id)
                .status(expectedStatus)
                .updatedAt(clock.instant())
                .build();
            return commit(current, updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Task requeue(String id) throws TaskNotFoundException, IllegalTransitionException {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Located current = locate(id).orElseThrow(() -> new TaskNotFoundException(id));
            TaskStatus target = current.task.isRequiresApproval() ? TaskStatus.NEEDS_ACTION : TaskStatus.NEW;
            requireStatus(current.task, TaskStatus.IN_PROGRESS, target);

            Task requeued = current.task.toBuilder()
                .status(target)
                .updatedAt(clock.instant())
                .build();
            return commit(current, requeued);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Task> get(String id) {
        return locate(id).map(located -> located.task);
    }

    @Override
    public List<Task> list(TaskStatus status) {
        List<Task> tasks = new ArrayList<>();
        for (Path document : documents(partitions.get(status))) {
            readQuietly(document, status).ifPresent(tasks::add);
        }
        return tasks;
    }

    @Override
    public List<Task> listAll() {
        List<Task> tasks = new ArrayList<>();
        for (TaskStatus status : TaskStatus.values()) {
            tasks.addAll(list(status));
        }
        return tasks;
    }

    @Override
    public List<IntakeItem> scanIntake() {
        List<IntakeItem> items = new ArrayList<>();
        for (Path document : documents(partitions.get(TaskStatus.NEW))) {
            Task task;
            try {
                task = read(document, TaskStatus.NEW);
            } catch (NoSuchFileException e) {
                logger.debug("Intake document {} moved during scan", document.getFileName());
                continue;
            } catch (InvalidTaskDocumentException e) {
                logger.warn("Rejected intake document {}: {}", document.getFileName(), e.getMessage());
                items.add(IntakeItem.rejected(document, e.getMessage()));
                continue;
            } catch (IOException e) {
                throw new TaskStoreException("Failed to read intake document " + document, e);
            }

            boolean unregistered = task.getId() == null || !TaskIdGenerator.isValidId(task.getId());
            String canonicalName = unregistered ? null : TaskIdGenerator.fileName(task.getId(), task.getTitle());
            if (!unregistered && canonicalName.equals(document.getFileName().toString())) {
                items.add(IntakeItem.accepted(document, task, false));
                continue;
            }

            register(document, task, unregistered).ifPresent(items::add);
        }
        return items;
    }

    @Override
    public Task quarantine(Path document, String error) {
        String raw;
        try {
            raw = Files.readString(document, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaskStoreException("Failed to read document for quarantine: " + document, e);
        }

        Instant now = clock.instant();
        String originalName = document.getFileName().toString();
        Task quarantined = TaskImpl.builder()
            .id(idGenerator.generate(now, Source.UNKNOWN))
            .source(Source.UNKNOWN)
            .title("quarantined " + originalName)
            .status(TaskStatus.FAILED)
            .failureReason(error)
            .payload(new Payload(raw, Map.of(ORIGINAL_FILE_FIELD, originalName)))
            .createdAt(now)
            .updatedAt(now)
            .build();

        ReentrantLock lock = lockFor(quarantined.getId());
        lock.lock();
        try {
            if (!relocate(document, quarantined)) {
                throw new TaskStoreException("Document disappeared before quarantine: " + document,
                    new NoSuchFileException(document.toString()));
            }
        } finally {
            lock.unlock();
        }
        logger.warn("Quarantined malformed document {} as {}: {}", originalName, quarantined.getId(), error);
        return quarantined;
    }

    @Override
    public Path getRoot() {
        return root;
    }

    public Path getPartition(TaskStatus status) {
        return partitions.get(status);
    }

    private Optional<IntakeItem> register(Path document, Task task, boolean unregistered) {
        String id = unregistered ? idGenerator.generate(task.getCreatedAt(), task.getSource()) : task.getId();
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            if (!unregistered) {
                Optional<Located> existing = locate(id);
                if (existing.isPresent() && !existing.get().path.equals(document)) {
                    String error = "duplicate task id " + id;
                    logger.warn("Rejected intake document {}: {}", document.getFileName(), error);
                    return Optional.of(IntakeItem.rejected(document, error));
                }
            }

            Task registered = task.toBuilder()
                .id(id)
                .status(TaskStatus.NEW)
                .updatedAt(clock.instant())
                .build();
            if (!relocate(document, registered)) {
                logger.debug("Intake document {} moved during registration", document.getFileName());
                return Optional.empty();
            }
            Path canonical = partitions.get(TaskStatus.NEW).resolve(TaskIdGenerator.fileName(id, registered.getTitle()));
            logger.info("Registered intake document {} as task {}", document.getFileName(), id);
            return Optional.of(IntakeItem.accepted(canonical, registered, true));
        } finally {
            lock.unlock();
        }
    }

    private Task commit(Located current, Task next) throws TaskNotFoundException, IllegalTransitionException {
        if (!relocate(current.path, next)) {
            Located moved = locate(next.getId()).orElseThrow(() -> new TaskNotFoundException(next.getId()));
            throw new IllegalTransitionException(next.getId(), moved.task.getStatus(), next.getStatus());
        }
        logger.debug("Task {} {} -> {}", next.getId(), current.task.getStatus().wireName(), next.getStatus().wireName());
        return next;
    }

    private void requireStatus(Task task, TaskStatus expected, TaskStatus target) throws IllegalTransitionException {
        if (task.getStatus() != expected) {
            throw new IllegalTransitionException(task.getId(), task.getStatus(), target);
        }
    }

    /**
     * Moves {@code source} to the document for {@code next} in its status partition.
     *
     * @return false if {@code source} no longer exists, i.e. another writer took it first
     */
    private boolean relocate(Path source, Task next) {
        Path partition = partitions.get(next.getStatus());
        String fileName = TaskIdGenerator.fileName(next.getId(), next.getTitle());
        Path pending = partition.resolve("." + fileName + PENDING_SUFFIX);

        try {
            Files.move(source, pending, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new TaskStoreException("Failed to stage " + source + " for transition", e);
        }

        try {
            // the rename keeps the source's mtime; recovery measures staging age from here
            Files.setLastModifiedTime(pending, FileTime.from(Instant.now()));
        } catch (IOException e) {
            throw rollback(pending, source, new TaskStoreException("Failed to stage " + source + " for transition", e));
        }

        try {
            write(next);
        } catch (TaskStoreException e) {
            throw rollback(pending, source, e);
        }

        try {
            Files.delete(pending);
        } catch (IOException e) {
            // The transition is committed; the daemon's recovery pass removes the leftover
            logger.warn("Failed to remove staging file {}", pending, e);
        }
        return true;
    }

    private static TaskStoreException rollback(Path pending, Path source, TaskStoreException failure) {
        try {
            Files.move(pending, source, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException rollback) {
            failure.addSuppressed(rollback);
        }
        return failure;
    }

    private void write(Task task) {
        Path partition = partitions.get(task.getStatus());
        String fileName = TaskIdGenerator.fileName(task.getId(), task.getTitle());
        Path tmp = partition.resolve("." + fileName + TMP_SUFFIX);
        try {
            Files.writeString(tmp, codec.encode(task), StandardCharsets.UTF_8);
            Files.move(tmp, partition.resolve(fileName), StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new TaskStoreException("Failed to write task " + task.getId(), e);
        }
    }

    private Optional<Located> locate(String id) {
        for (TaskStatus status : TaskStatus.values()) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(partitions.get(status), id + "*" + DOCUMENT_SUFFIX)) {
                for (Path candidate : stream) {
                    if (!id.equals(TaskIdGenerator.idFromFileName(candidate.getFileName().toString()))) {
                        continue;
                    }
                    Optional<Task> task = readQuietly(candidate, status);
                    if (task.isPresent() && id.equals(task.get().getId())) {
                        return Optional.of(new Located(candidate, task.get()));
                    }
                }
            } catch (IOException e) {
                throw new TaskStoreException("Failed to search partition " + status.wireName() + " for task " + id, e);
            }
        }
        return Optional.empty();
    }

    private List<Path> documents(Path partition) {
        List<Path> documents = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(partition, "*" + DOCUMENT_SUFFIX)) {
            for (Path document : stream) {
                if (!document.getFileName().toString().startsWith(".")) {
                    documents.add(document);
                }
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to list partition " + partition, e);
        }
        documents.sort(null);
        return documents;
    }

    /**
     * Reads a document. The partition a document lives in is authoritative for its status.
     */
    private Task read(Path document, TaskStatus partitionStatus) throws IOException, InvalidTaskDocumentException {
        String text = Files.readString(document, StandardCharsets.UTF_8);
        Instant modified = Files.getLastModifiedTime(document).toInstant();
        Task task = codec.decode(text, modified);
        if (task.getStatus() != partitionStatus) {
            task = task.toBuilder().status(partitionStatus).build();
        }
        return task;
    }

    private Optional<Task> readQuietly(Path document, TaskStatus partitionStatus) {
        try {
            Task task = read(document, partitionStatus);
            return task.getId() != null ? Optional.of(task) : Optional.empty();
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (InvalidTaskDocumentException e) {
            logger.debug("Skipping unreadable document {}: {}", document, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new TaskStoreException("Failed to read task document " + document, e);
        }
    }

    @Override
    public int recover(Duration minAge) {
        Instant cutoff = Instant.now().minus(minAge);
        int resolved = 0;
        for (Path partition : partitions.values()) {
            List<Path> staged = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(partition, ".*")) {
                stream.forEach(staged::add);
            } catch (IOException e) {
                throw new TaskStoreException("Failed to scan partition " + partition + " for recovery", e);
            }

            for (Path file : staged) {
                String name = file.getFileName().toString();
                try {
                    if (!name.endsWith(TMP_SUFFIX) && !name.endsWith(PENDING_SUFFIX)) {
                        continue;
                    }
                    if (Files.getLastModifiedTime(file).toInstant().isAfter(cutoff)) {
                        logger.debug("Leaving recent staging file {} to its writer", file);
                        continue;
                    }
                    if (name.endsWith(TMP_SUFFIX)) {
                        Files.deleteIfExists(file);
                        logger.info("Recovery removed incomplete write {}", file);
                    } else {
                        recoverPending(partition, file, name.substring(1, name.length() - PENDING_SUFFIX.length()));
                    }
                    resolved++;
                } catch (NoSuchFileException e) {
                    logger.debug("Staging file {} was resolved by its writer", file);
                } catch (IOException e) {
                    throw new TaskStoreException("Failed to recover staging file " + file, e);
                }
            }
        }
        return resolved;
    }

    private void recoverPending(Path partition, Path pending, String finalName) throws IOException {
        if (Files.exists(partition.resolve(finalName))) {
            Files.delete(pending);
            logger.info("Recovery completed interrupted transition of {}", finalName);
            return;
        }

        TaskStatus original;
        try {
            original = codec.decode(Files.readString(pending, StandardCharsets.UTF_8), Instant.EPOCH).getStatus();
        } catch (InvalidTaskDocumentException e) {
            original = TaskStatus.NEW;
        }
        Path restored = partitions.get(original).resolve(finalName);
        Files.move(pending, restored, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Recovery rolled back interrupted transition, restored {}", restored);
    }

    private ReentrantLock lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }

    private static final class Located {
        final Path path;
        final Task task;

        Located(Path path, Task task) {
            this.path = path;
            this.task = task;
        }
    }
}
