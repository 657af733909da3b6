package com.enterprise.taskrouting.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Task payload: the free-form document body plus the structured fields
 * an eventual action needs (contact, media reference, batch size, steps).
 * Immutable.
 */
public final class Payload {

    public static final String CONTACT = "contact";
    public static final String BATCH_SIZE = "batch_size";
    public static final String STEPS = "steps";
    public static final String MEDIA = "media";

    private final String body;
    private final Map<String, String> fields;

    public Payload(String body, Map<String, String> fields) {
        this.body = body != null ? body : "";
        this.fields = fields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
            : Collections.emptyMap();
    }

    public static Payload ofBody(String body) {
        return new Payload(body, Map.of());
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name)).filter(value -> !value.isBlank());
    }

    public Payload withBody(String newBody) {
        return new Payload(newBody, fields);
    }

    public Payload withField(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new Payload(body, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return body.equals(payload.body) && fields.equals(payload.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, fields);
    }

    @Override
    public String toString() {
        return "Payload{fields=" + fields + ", bodyLength=" + body.length() + '}';
    }
}
