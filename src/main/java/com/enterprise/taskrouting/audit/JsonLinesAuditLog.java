package com.enterprise.taskrouting.audit;

import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.TaskStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Audit log stored as a single JSON Lines file, one entry per line.
 * In-process writers are serialized through a lock; other processes sharing
 * the file are excluded with an OS file lock held for the duration of each append.
 */
public class JsonLinesAuditLog implements AuditLog {

    private static final Logger logger = LoggerFactory.getLogger(JsonLinesAuditLog.class);

    private final Path logFile;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong totalAppended = new AtomicLong(0);

    public JsonLinesAuditLog(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to create audit log directory for " + logFile, e);
        }

        logger.info("Audit log initialized at: {}", logFile);
    }

    @Override
    public void append(AuditEntry entry) {
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Failed to serialize audit entry for task " + entry.getTaskId(), e);
        }

        writeLock.lock();
        try (FileChannel channel = FileChannel.open(logFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
             FileLock ignored = channel.lock()) {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);
            totalAppended.incrementAndGet();
            logger.debug("Audit {} for task {}: {}", entry.getEventType().wireName(), entry.getTaskId(), entry.getDetail());
        } catch (IOException e) {
            logger.error("Failed to append audit entry for task {}", entry.getTaskId(), e);
            throw new TaskStoreException("Failed to append audit entry", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public AuditEntry record(String taskId, AuditEventType eventType, String detail, TaskStatus statusAfter) {
        AuditEntry entry = new AuditEntry(clock.instant(), taskId, eventType, detail, statusAfter);
        append(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> readAll() {
        List<AuditEntry> entries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                parse(line, lineNumber).ifPresent(entries::add);
            }
        } catch (NoSuchFileException e) {
            return entries;
        } catch (IOException e) {
            throw new TaskStoreException("Failed to read audit log " + logFile, e);
        }
        return entries;
    }

    /**
     * Number of entries appended through this instance
     */
    public long getTotalAppended() {
        return totalAppended.get();
    }

    public Path getLogFile() {
        return logFile;
    }

    private Optional<AuditEntry> parse(String line, int lineNumber) {
        try {
            return Optional.of(objectMapper.readValue(line, AuditEntry.class));
        } catch (JsonProcessingException e) {
            logger.error("Skipping unreadable audit line {} in {}", lineNumber, logFile, e);
            return Optional.empty();
        }
    }
}
