package com.enterprise.taskrouting.report;

import java.util.List;
import java.util.Locale;

/**
 * Coarse content buckets for the briefing. A task lands in the first
 * category whose keywords appear in its title or body.
 */
public enum ContentCategory {
    REVENUE("revenue", List.of("payment", "revenue", "sale", "income", "profit", "$", "usd", "pkr")),
    BOTTLENECKS("bottlenecks", List.of("blocked", "stuck", "waiting", "issue", "error", "failed", "problem", "delay")),
    TASKS("tasks", List.of("task", "todo", "action", "complete", "done", "pending", "review")),
    MESSAGES("messages", List.of());

    private final String wireName;
    private final List<String> keywords;

    ContentCategory(String wireName, List<String> keywords) {
        this.wireName = wireName;
        this.keywords = keywords;
    }

    public String wireName() {
        return wireName;
    }

    public static ContentCategory categorize(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        for (ContentCategory category : values()) {
            if (category.keywords.stream().anyMatch(lower::contains)) {
                return category;
            }
        }
        return MESSAGES;
    }
}
