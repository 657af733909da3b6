package com.enterprise.taskrouting.report;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time window a report summarizes, ending at the moment the report runs
 */
public final class ReportWindow {

    private static final Pattern RELATIVE = Pattern.compile("(\\d+)([dh])");

    private final String name;
    private final Duration length;

    private ReportWindow(String name, Duration length) {
        this.name = name;
        this.length = length;
    }

    public static ReportWindow of(String name, Duration length) {
        if (length.isNegative() || length.isZero()) {
            throw new IllegalArgumentException("Report window must be positive: " + name);
        }
        return new ReportWindow(name, length);
    }

    /**
     * Parses {@code daily}, {@code weekly}, {@code monthly}, {@code <n>d}, {@code <n>h}
     * or an ISO-8601 duration such as {@code P14D}
     *
     * @throws IllegalArgumentException if the value is none of these
     */
    public static ReportWindow parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Report window is required");
        }
        String text = value.trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "daily":
                return of(text, Duration.ofDays(1));
            case "weekly":
                return of(text, Duration.ofDays(7));
            case "monthly":
                return of(text, Duration.ofDays(30));
            default:
                break;
        }

        Matcher matcher = RELATIVE.matcher(text);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return of(text, "d".equals(matcher.group(2)) ? Duration.ofDays(amount) : Duration.ofHours(amount));
        }

        try {
            return of(text, Duration.parse(text.toUpperCase(Locale.ROOT)));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unknown report window: " + value, e);
        }
    }

    public String getName() {
        return name;
    }

    public Duration getLength() {
        return length;
    }

    public Instant startFor(Instant end) {
        return end.minus(length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReportWindow that = (ReportWindow) o;
        return name.equals(that.name) && length.equals(that.length);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, length);
    }

    @Override
    public String toString() {
        return name + " (" + length + ")";
    }
}
