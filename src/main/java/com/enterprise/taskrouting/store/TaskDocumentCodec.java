package com.enterprise.taskrouting.store;

import com.enterprise.taskrouting.core.Domain;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.Priority;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.InvalidTaskDocumentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes task documents: a {@code ---} fenced YAML header of
 * key/value pairs followed by the free-form markdown body.
 * <p>
 * Header keys that are not task fields are carried as structured payload
 * fields. Producer documents may omit everything but {@code source}; the
 * legacy producer keys {@code created} and {@code status: pending} are accepted.
 */
public class TaskDocumentCodec {

    static final String FENCE = "---";

    private static final String ID = "id";
    private static final String SOURCE = "source";
    private static final String TITLE = "title";
    private static final String STATUS = "status";
    private static final String DOMAIN = "domain";
    private static final String INTENT = "intent";
    private static final String PRIORITY = "priority";
    private static final String RETRY_COUNT = "retry_count";
    private static final String ITERATION_COUNT = "iteration_count";
    private static final String REQUIRES_APPROVAL = "requires_approval";
    private static final String APPROVED = "approved";
    private static final String FAILURE_REASON = "failure_reason";
    private static final String CREATED_AT = "created_at";
    private static final String UPDATED_AT = "updated_at";
    private static final String LEGACY_CREATED = "created";

    private static final Set<String> TASK_KEYS = Set.of(ID, SOURCE, TITLE, STATUS, DOMAIN, INTENT, PRIORITY,
        RETRY_COUNT, ITERATION_COUNT, REQUIRES_APPROVAL, APPROVED, FAILURE_REASON, CREATED_AT, UPDATED_AT,
        LEGACY_CREATED);

    private static final int MAX_TITLE_LENGTH = 80;

    private final ObjectMapper yamlMapper;
    private final ZoneId zone;

    public TaskDocumentCodec(ZoneId zone) {
        this.zone = zone;
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
    }

    public static boolean isReservedKey(String key) {
        return TASK_KEYS.contains(key);
    }

    /**
     * Encodes a task as a document
     */
    public String encode(Task task) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put(ID, task.getId());
        header.put(SOURCE, task.getSource().wireName());
        header.put(TITLE, task.getTitle());
        header.put(STATUS, task.getStatus().wireName());
        header.put(DOMAIN, task.getDomain() != null ? task.getDomain().wireName() : null);
        header.put(INTENT, task.getIntent());
        header.put(PRIORITY, task.getPriority() != null ? task.getPriority().wireName() : null);
        header.put(RETRY_COUNT, task.getRetryCount());
        header.put(ITERATION_COUNT, task.getIterationCount());
        header.put(REQUIRES_APPROVAL, task.isRequiresApproval());
        header.put(APPROVED, task.getApproved());
        task.getFailureReason().ifPresent(reason -> header.put(FAILURE_REASON, reason));
        header.put(CREATED_AT, task.getCreatedAt().toString());
        header.put(UPDATED_AT, task.getUpdatedAt().toString());
        task.getPayload().getFields().forEach((key, value) -> {
            if (!isReservedKey(key)) {
                header.put(key, value);
            }
        });

        String headerText;
        try {
            headerText = yamlMapper.writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode header for task " + task.getId(), e);
        }

        StringBuilder document = new StringBuilder();
        document.append(FENCE).append('\n').append(headerText);
        if (!headerText.endsWith("\n")) {
            document.append('\n');
        }
        document.append(FENCE).append("\n\n").append(task.getPayload().getBody());
        if (!task.getPayload().getBody().endsWith("\n")) {
            document.append('\n');
        }
        return document.toString();
    }

    /**
     * Decodes a document.
     *
     * @param text raw document text
     * @param fallbackCreatedAt creation time used when the header carries none
     * @throws InvalidTaskDocumentException if the document is malformed or lacks a source
     */
    public Task decode(String text, Instant fallbackCreatedAt) throws InvalidTaskDocumentException {
        String normalized = text.replace("\r\n", "\n");
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }
        if (!normalized.startsWith(FENCE + "\n")) {
            throw new InvalidTaskDocumentException("Document does not start with a '---' metadata header");
        }
        int headerStart = FENCE.length() + 1;
        int headerEnd = findClosingFence(normalized, headerStart);
        if (headerEnd < 0) {
            throw new InvalidTaskDocumentException("Metadata header is not terminated by '---'");
        }

        String headerText = normalized.substring(headerStart, headerEnd);
        int bodyStart = normalized.indexOf('\n', headerEnd);
        String body = bodyStart < 0 ? "" : normalized.substring(bodyStart + 1).strip();

        Map<String, Object> header = parseHeader(headerText);

        String sourceValue = string(header, SOURCE);
        if (sourceValue == null) {
            throw new InvalidTaskDocumentException("Required field 'source' is missing");
        }

        try {
            Instant createdAt = firstInstant(header, CREATED_AT, LEGACY_CREATED);
            if (createdAt == null) {
                createdAt = fallbackCreatedAt;
            }
            Instant updatedAt = firstInstant(header, UPDATED_AT);

            Map<String, String> fields = new LinkedHashMap<>();
            header.forEach((key, value) -> {
                if (!isReservedKey(key) && value != null) {
                    fields.put(key, String.valueOf(value));
                }
            });

            String title = string(header, TITLE);
            if (title == null) {
                title = deriveTitle(body);
            }

            return TaskImpl.builder()
                .id(string(header, ID))
                .source(Source.fromWire(sourceValue))
                .title(title)
                .status(parseStatus(string(header, STATUS)))
                .domain(parseOptional(string(header, DOMAIN), Domain::fromWire))
                .intent(string(header, INTENT))
                .priority(parseOptional(string(header, PRIORITY), Priority::fromWire))
                .retryCount(integer(header, RETRY_COUNT))
                .iterationCount(integer(header, ITERATION_COUNT))
                .requiresApproval(bool(header, REQUIRES_APPROVAL))
                .approved(optionalBool(header, APPROVED))
                .failureReason(string(header, FAILURE_REASON))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .payload(new Payload(body, fields))
                .build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidTaskDocumentException("Invalid field value: " + e.getMessage(), e);
        }
    }

    /**
     * First markdown heading of the body, else its first non-blank line
     */
    static String deriveTitle(String body) {
        String candidate = body.lines()
            .map(String::strip)
            .filter(line -> line.startsWith("#"))
            .findFirst()
            .map(line -> line.replaceFirst("^#+", "").strip())
            .orElseGet(() -> body.lines().map(String::strip).filter(line -> !line.isEmpty()).findFirst().orElse(""));
        return candidate.length() > MAX_TITLE_LENGTH ? candidate.substring(0, MAX_TITLE_LENGTH) : candidate;
    }

    private int findClosingFence(String text, int from) {
        int position = from;
        while (position <= text.length()) {
            int lineEnd = text.indexOf('\n', position);
            String line = lineEnd < 0 ? text.substring(position) : text.substring(position, lineEnd);
            if (line.strip().equals(FENCE)) {
                return position;
            }
            if (lineEnd < 0) {
                return -1;
            }
            position = lineEnd + 1;
        }
        return -1;
    }

    private Map<String, Object> parseHeader(String headerText) throws InvalidTaskDocumentException {
        if (headerText.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> header = yamlMapper.readValue(headerText, new TypeReference<LinkedHashMap<String, Object>>() {});
            return header != null ? header : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new InvalidTaskDocumentException("Metadata header is not valid key/value YAML: " + e.getOriginalMessage(), e);
        }
    }

    private TaskStatus parseStatus(String value) {
        if (value == null || value.equalsIgnoreCase("pending")) {
            return TaskStatus.NEW;
        }
        return TaskStatus.fromWire(value);
    }

    private Instant firstInstant(Map<String, Object> header, String... keys) {
        for (String key : keys) {
            String value = string(header, key);
            if (value != null) {
                return parseInstant(value);
            }
        }
        return null;
    }

    private Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException notInstant) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException notOffset) {
                return LocalDateTime.parse(value).atZone(zone).toInstant();
            }
        }
    }

    private static <T> T parseOptional(String value, java.util.function.Function<String, T> parser) {
        return value == null ? null : parser.apply(value);
    }

    private static String string(Map<String, Object> header, String key) {
        Object value = header.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).strip();
        return text.isEmpty() || text.equals("null") ? null : text;
    }

    private static int integer(Map<String, Object> header, String key) {
        String value = string(header, key);
        return value == null ? 0 : Integer.parseInt(value);
    }

    private static boolean bool(Map<String, Object> header, String key) {
        Boolean value = optionalBool(header, key);
        return value != null && value;
    }

    private static Boolean optionalBool(Map<String, Object> header, String key) {
        String value = string(header, key);
        if (value == null) {
            return null;
        }
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes")) {
            return Boolean.TRUE;
        }
        if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("'" + key + "' must be true or false, was " + value);
    }
}
