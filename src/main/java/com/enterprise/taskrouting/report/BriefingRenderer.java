package com.enterprise.taskrouting.report;

import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a summary as a markdown briefing with the same fenced header layout
 * as task documents
 */
public class BriefingRenderer {

    private static final String FENCE = "---";
    private static final int MAX_LISTED = 5;
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
    private final ZoneId zone;

    public BriefingRenderer(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * File name for the briefing, e.g. {@code 20240107_080000_weekly_briefing.md}
     */
    public String fileName(WeeklySummary summary) {
        String window = summary.getWindow().getName().replaceAll("[^a-z0-9]+", "_");
        return FILE_STAMP.format(summary.getPeriodEnd().atZone(zone)) + "_" + window + "_briefing.md";
    }

    public String render(WeeklySummary summary) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("type", "briefing");
        header.put("window", summary.getWindow().getName());
        header.put("period_start", summary.getPeriodStart().toString());
        header.put("period_end", summary.getPeriodEnd().toString());
        header.put("total_tasks", summary.getTotalTasks());
        for (TaskStatus status : TaskStatus.values()) {
            header.put(status.wireName(), summary.getCount(status));
        }
        header.put("stale_needs_action", summary.getStaleTaskIds().size());

        String headerText;
        try {
            headerText = yamlMapper.writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode briefing header", e);
        }

        StringBuilder out = new StringBuilder();
        out.append(FENCE).append('\n').append(headerText);
        if (!headerText.endsWith("\n")) {
            out.append('\n');
        }
        out.append(FENCE).append("\n\n");

        out.append("# Briefing: ").append(summary.getWindow().getName()).append("\n\n");
        out.append("**Period:** ").append(DAY.format(summary.getPeriodStart().atZone(zone)))
            .append(" to ").append(DAY.format(summary.getPeriodEnd().atZone(zone))).append("\n\n");

        out.append("## Key Metrics\n\n");
        out.append("- **Total tasks:** ").append(summary.getTotalTasks()).append('\n');
        for (TaskStatus status : TaskStatus.values()) {
            out.append("- **").append(status.wireName()).append(":** ").append(summary.getCount(status)).append('\n');
        }
        out.append('\n');

        out.append("## By Domain\n\n");
        appendCounts(out, summary.getDomainCounts());

        out.append("## By Source\n\n");
        Map<String, Long> sources = new LinkedHashMap<>();
        for (Map.Entry<Source, Long> entry : summary.getSourceCounts().entrySet()) {
            sources.put(entry.getKey().wireName(), entry.getValue());
        }
        appendCounts(out, sources);

        out.append("## Audit Activity\n\n");
        Map<String, Long> events = new LinkedHashMap<>();
        for (Map.Entry<AuditEventType, Long> entry : summary.getAuditEventCounts().entrySet()) {
            events.put(entry.getKey().wireName(), entry.getValue());
        }
        appendCounts(out, events);

        out.append("## Stale Approvals\n\n");
        if (summary.getStaleTaskIds().isEmpty()) {
            out.append("*No tasks waiting past the staleness threshold.*\n\n");
        } else {
            summary.getStaleTaskIds().forEach(id -> out.append("- ").append(id).append('\n'));
            out.append('\n');
        }

        appendCategory(out, "Revenue", summary.getCategories().get(ContentCategory.REVENUE),
            "*No revenue items identified.*");
        appendCategory(out, "Bottlenecks", summary.getCategories().get(ContentCategory.BOTTLENECKS),
            "*No bottlenecks identified.*");
        appendCategory(out, "Tasks", summary.getCategories().get(ContentCategory.TASKS),
            "*No tasks identified.*");

        out.append("## Recommendations\n\n");
        summary.getRecommendations().forEach(line -> out.append("- ").append(line).append('\n'));
        return out.toString();
    }

    private static void appendCounts(StringBuilder out, Map<String, Long> counts) {
        if (counts.isEmpty()) {
            out.append("*None.*\n\n");
            return;
        }
        counts.forEach((key, count) -> out.append("- ").append(key).append(": ").append(count).append('\n'));
        out.append('\n');
    }

    private static void appendCategory(StringBuilder out, String title, List<String> ids, String empty) {
        out.append("## ").append(title).append("\n\n");
        if (ids == null || ids.isEmpty()) {
            out.append(empty).append("\n\n");
            return;
        }
        out.append("**Items:** ").append(ids.size()).append("\n\n");
        ids.stream().limit(MAX_LISTED).forEach(id -> out.append("- ").append(id).append('\n'));
        out.append('\n');
    }
}
