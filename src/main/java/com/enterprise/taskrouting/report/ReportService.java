package com.enterprise.taskrouting.report;

import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.exception.TaskStoreException;
import com.enterprise.taskrouting.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * One report run: aggregate, write the briefing document, audit that it ran
 */
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    private final WeeklyAggregator aggregator;
    private final BriefingRenderer renderer;
    private final AuditLog auditLog;
    private final Path briefingsDir;

    public ReportService(WeeklyAggregator aggregator, BriefingRenderer renderer, AuditLog auditLog, Path briefingsDir) {
        this.aggregator = aggregator;
        this.renderer = renderer;
        this.auditLog = auditLog;
        this.briefingsDir = briefingsDir;
    }

    /**
     * @return path of the written briefing
     * @throws TaskStoreException if the briefing cannot be written
     */
    public Path generate(ReportWindow window) {
        MdcContext.setReport(window.getName());
        try {
            WeeklySummary summary = aggregator.aggregate(window);
            String fileName = renderer.fileName(summary);
            Path target = briefingsDir.resolve(fileName);
            write(target, renderer.render(summary));

            auditLog.record(fileName, AuditEventType.REPORT_GENERATED,
                window.getName() + " briefing: " + summary.getTotalTasks() + " tasks, "
                    + summary.getStaleTaskIds().size() + " stale",
                null);
            logger.info("Briefing written to {}", target);
            return target;
        } finally {
            MdcContext.clear();
        }
    }

    private static void write(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling("." + target.getFileName() + ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new TaskStoreException("Failed to write briefing " + target, e);
        }
    }
}
