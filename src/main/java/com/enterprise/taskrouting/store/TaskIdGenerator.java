package com.enterprise.taskrouting.store;

import com.enterprise.taskrouting.core.Source;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generates task ids and document filenames that sort chronologically in a
 * directory listing: {@code yyyyMMdd_HHmmss_<source>_<suffix>}.
 */
public class TaskIdGenerator {

    private static final int SUFFIX_LENGTH = 6;
    private static final int MAX_SLUG_LENGTH = 48;
    private static final String HEX = "0123456789abcdef";
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private final DateTimeFormatter timestampFormat;
    private final SecureRandom random = new SecureRandom();

    public TaskIdGenerator(ZoneId zone) {
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(zone);
    }

    public String generate(Instant createdAt, Source source) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(HEX.charAt(random.nextInt(HEX.length())));
        }
        return timestampFormat.format(createdAt) + "_" + source.wireName() + "_" + suffix;
    }

    /**
     * Canonical document filename: {@code <id>--<slug>.md}
     */
    public static String fileName(String id, String title) {
        String slug = slug(title);
        return slug.isEmpty() ? id + ".md" : id + "--" + slug + ".md";
    }

    static String slug(String title) {
        if (title == null) {
            return "";
        }
        String slug = title.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("_+$", "");
        }
        return slug;
    }

    /**
     * Extracts the task id from a document filename, or null for staging and non-document files
     */
    public static String idFromFileName(String fileName) {
        if (!fileName.endsWith(".md") || fileName.startsWith(".")) {
            return null;
        }
        String stem = fileName.substring(0, fileName.length() - ".md".length());
        int separator = stem.indexOf("--");
        return separator >= 0 ? stem.substring(0, separator) : stem;
    }

    /**
     * Ids become part of filenames, so they are restricted to a filename-safe alphabet
     */
    public static boolean isValidId(String id) {
        return id != null && VALID_ID.matcher(id).matches() && !id.contains("--");
    }
}
