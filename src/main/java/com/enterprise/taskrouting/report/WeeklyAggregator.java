package com.enterprise.taskrouting.report;

import com.enterprise.taskrouting.audit.AuditEntry;
import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Summarizes the store and the audit log over a time window. Read-only: it never
 * changes a task.
 */
public class WeeklyAggregator {

    private static final Logger logger = LoggerFactory.getLogger(WeeklyAggregator.class);

    static final String UNCLASSIFIED = "unclassified";
    private static final int PENDING_REVIEW_THRESHOLD = 5;
    private static final int INBOX_VOLUME_THRESHOLD = 10;

    private final TaskStore store;
    private final AuditLog auditLog;
    private final Duration staleThreshold;
    private final Clock clock;

    public WeeklyAggregator(TaskStore store, AuditLog auditLog, Duration staleThreshold, Clock clock) {
        this.store = store;
        this.auditLog = auditLog;
        this.staleThreshold = staleThreshold;
        this.clock = clock;
    }

    public WeeklySummary aggregate(ReportWindow window) {
        Instant end = clock.instant();
        Instant start = window.startFor(end);
        List<Task> all = store.listAll();

        List<Task> inWindow = all.stream()
            .filter(task -> !task.getCreatedAt().isBefore(start) && !task.getCreatedAt().isAfter(end))
            .collect(Collectors.toList());

        Map<TaskStatus, Long> statusCounts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            statusCounts.put(status, 0L);
        }
        Map<String, Long> domainCounts = new TreeMap<>();
        Map<Source, Long> sourceCounts = new EnumMap<>(Source.class);
        Map<ContentCategory, List<String>> categories = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : ContentCategory.values()) {
            categories.put(category, new ArrayList<>());
        }

        for (Task task : inWindow) {
            statusCounts.merge(task.getStatus(), 1L, Long::sum);
            domainCounts.merge(task.getDomain() != null ? task.getDomain().wireName() : UNCLASSIFIED, 1L, Long::sum);
            sourceCounts.merge(task.getSource(), 1L, Long::sum);
            ContentCategory category = ContentCategory.categorize(task.getTitle() + "\n" + task.getPayload().getBody());
            categories.get(category).add(task.getId());
        }

        Map<AuditEventType, Long> auditCounts = new EnumMap<>(AuditEventType.class);
        for (AuditEntry entry : auditLog.readBetween(start, end)) {
            auditCounts.merge(entry.getEventType(), 1L, Long::sum);
        }

        Instant staleBefore = end.minus(staleThreshold);
        List<String> stale = all.stream()
            .filter(task -> task.getStatus() == TaskStatus.NEEDS_ACTION)
            .filter(task -> task.getUpdatedAt().isBefore(staleBefore))
            .sorted(Comparator.comparing(Task::getUpdatedAt))
            .map(Task::getId)
            .collect(Collectors.toList());

        WeeklySummary summary = WeeklySummary.builder()
            .window(window)
            .period(start, end)
            .statusCounts(statusCounts)
            .domainCounts(domainCounts)
            .sourceCounts(sourceCounts)
            .auditEventCounts(auditCounts)
            .staleTaskIds(stale)
            .categories(categories)
            .recommendations(recommend(statusCounts, stale, categories))
            .build();

        logger.info("Aggregated {} tasks over {} ({} stale)", inWindow.size(), window, stale.size());
        return summary;
    }

    private List<String> recommend(Map<TaskStatus, Long> statusCounts, List<String> stale,
                                   Map<ContentCategory, List<String>> categories) {
        List<String> recommendations = new ArrayList<>();
        int bottlenecks = categories.get(ContentCategory.BOTTLENECKS).size();
        long pending = statusCounts.get(TaskStatus.NEEDS_ACTION);
        long failed = statusCounts.get(TaskStatus.FAILED);
        long done = statusCounts.get(TaskStatus.DONE);

        if (bottlenecks > 0) {
            recommendations.add("Priority: address " + bottlenecks + " bottleneck(s)");
        }
        if (!stale.isEmpty()) {
            recommendations.add("Approvals: " + stale.size() + " task(s) waiting longer than "
                + staleThreshold.toHours() + "h");
        }
        if (pending > PENDING_REVIEW_THRESHOLD) {
            recommendations.add("Action: " + pending + " tasks pending review");
        }
        if (statusCounts.get(TaskStatus.NEW) > INBOX_VOLUME_THRESHOLD) {
            recommendations.add("Inbox: high volume, process pending messages");
        }
        if (failed > 0) {
            recommendations.add("Failures: review " + failed + " failed task(s)");
        }
        if (done > 0) {
            recommendations.add("Progress: " + done + " tasks completed this period");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("All systems operating normally");
        }
        return recommendations;
    }
}
