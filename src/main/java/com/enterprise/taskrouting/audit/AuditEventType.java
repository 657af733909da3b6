package com.enterprise.taskrouting.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of orchestration events recorded in the audit log
 */
public enum AuditEventType {
    CREATED("created"),
    CLASSIFIED("classified"),
    APPROVAL_REQUESTED("approval_requested"),
    APPROVAL_GRANTED("approval_granted"),
    APPROVAL_DENIED("approval_denied"),
    ATTEMPT("attempt"),
    RETRY("retry"),
    SUCCESS("success"),
    FAILURE("failure"),
    MOVED("moved"),
    REPORT_GENERATED("report_generated");

    private final String wireName;

    AuditEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AuditEventType fromWire(String value) {
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown audit event type: " + value));
    }
}
