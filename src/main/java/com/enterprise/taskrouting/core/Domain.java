package com.enterprise.taskrouting.core;

import java.util.Locale;

/**
 * Coarse classification driving routing policy
 */
public enum Domain {
    PERSONAL,
    BUSINESS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Domain fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
