package com.enterprise.taskrouting.core;

import java.util.Arrays;
import java.util.Locale;

/**
 * Producer channels that deposit task documents into the intake partition.
 * Unrecognised producer identifiers map to {@link #UNKNOWN}.
 */
public enum Source {
    GMAIL,
    WHATSAPP,
    LINKEDIN,
    FACEBOOK,
    INSTAGRAM,
    TWITTER,
    INBOX,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Source fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(source -> source.name().equals(normalized))
            .findFirst()
            .orElse(UNKNOWN);
    }
}
