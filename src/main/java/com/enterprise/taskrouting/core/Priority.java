package com.enterprise.taskrouting.core;

import java.util.Locale;

/**
 * Informational task priority. The store does not order by it.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Priority fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
