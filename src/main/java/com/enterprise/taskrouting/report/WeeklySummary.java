package com.enterprise.taskrouting.report;

import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.TaskStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured result of one aggregation run
 */
public final class WeeklySummary {

    private final ReportWindow window;
    private final Instant periodStart;
    private final Instant periodEnd;
    private final Map<TaskStatus, Long> statusCounts;
    private final Map<String, Long> domainCounts;
    private final Map<Source, Long> sourceCounts;
    private final Map<AuditEventType, Long> auditEventCounts;
    private final List<String> staleTaskIds;
    private final Map<ContentCategory, List<String>> categories;
    private final List<String> recommendations;

    private WeeklySummary(Builder builder) {
        this.window = builder.window;
        this.periodStart = builder.periodStart;
        this.periodEnd = builder.periodEnd;
        this.statusCounts = Collections.unmodifiableMap(new EnumMap<>(builder.statusCounts));
        this.domainCounts = Collections.unmodifiableMap(new TreeMap<>(builder.domainCounts));
        this.sourceCounts = Collections.unmodifiableMap(new EnumMap<>(builder.sourceCounts));
        this.auditEventCounts = Collections.unmodifiableMap(new EnumMap<>(builder.auditEventCounts));
        this.staleTaskIds = List.copyOf(builder.staleTaskIds);
        this.categories = Collections.unmodifiableMap(new EnumMap<>(builder.categories));
        this.recommendations = List.copyOf(builder.recommendations);
    }

    public ReportWindow getWindow() { return window; }
    public Instant getPeriodStart() { return periodStart; }
    public Instant getPeriodEnd() { return periodEnd; }

    /**
     * Tasks created inside the window, per status; every status is present
     */
    public Map<TaskStatus, Long> getStatusCounts() { return statusCounts; }

    /**
     * Per domain wire name; unclassified tasks count under {@code unclassified}
     */
    public Map<String, Long> getDomainCounts() { return domainCounts; }
    public Map<Source, Long> getSourceCounts() { return sourceCounts; }
    public Map<AuditEventType, Long> getAuditEventCounts() { return auditEventCounts; }

    /**
     * Tasks waiting in {@code needs_action} longer than the staleness threshold, oldest first
     */
    public List<String> getStaleTaskIds() { return staleTaskIds; }
    public Map<ContentCategory, List<String>> getCategories() { return categories; }
    public List<String> getRecommendations() { return recommendations; }

    public long getCount(TaskStatus status) {
        return statusCounts.getOrDefault(status, 0L);
    }

    public long getTotalTasks() {
        return statusCounts.values().stream().mapToLong(Long::longValue).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReportWindow window;
        private Instant periodStart;
        private Instant periodEnd;
        private Map<TaskStatus, Long> statusCounts = new EnumMap<>(TaskStatus.class);
        private Map<String, Long> domainCounts = new TreeMap<>();
        private Map<Source, Long> sourceCounts = new EnumMap<>(Source.class);
        private Map<AuditEventType, Long> auditEventCounts = new EnumMap<>(AuditEventType.class);
        private List<String> staleTaskIds = List.of();
        private Map<ContentCategory, List<String>> categories = new EnumMap<>(ContentCategory.class);
        private List<String> recommendations = List.of();

        public Builder window(ReportWindow window) {
            this.window = window;
            return this;
        }

        public Builder period(Instant start, Instant end) {
            this.periodStart = start;
            this.periodEnd = end;
            return this;
        }

        public Builder statusCounts(Map<TaskStatus, Long> statusCounts) {
            this.statusCounts = statusCounts;
            return this;
        }

        public Builder domainCounts(Map<String, Long> domainCounts) {
            this.domainCounts = domainCounts;
            return this;
        }

        public Builder sourceCounts(Map<Source, Long> sourceCounts) {
            this.sourceCounts = sourceCounts;
            return this;
        }

        public Builder auditEventCounts(Map<AuditEventType, Long> auditEventCounts) {
            this.auditEventCounts = auditEventCounts;
            return this;
        }

        public Builder staleTaskIds(List<String> staleTaskIds) {
            this.staleTaskIds = staleTaskIds;
            return this;
        }

        public Builder categories(Map<ContentCategory, List<String>> categories) {
            this.categories = categories;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public WeeklySummary build() {
            if (window == null || periodStart == null || periodEnd == null) {
                throw new IllegalArgumentException("Summary window and period are required");
            }
            return new WeeklySummary(this);
        }
    }
}
