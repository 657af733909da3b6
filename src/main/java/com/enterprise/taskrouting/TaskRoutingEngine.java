package com.enterprise.taskrouting;

import com.enterprise.taskrouting.approval.ApprovalService;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.config.RoutingConfig;
import com.enterprise.taskrouting.monitoring.MetricsCollector;
import com.enterprise.taskrouting.orchestrator.Orchestrator;
import com.enterprise.taskrouting.report.ReportService;
import com.enterprise.taskrouting.report.ReportWindow;
import com.enterprise.taskrouting.retry.ActionRegistry;
import com.enterprise.taskrouting.scheduler.CronScheduler;
import com.enterprise.taskrouting.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The wired engine: store, audit log, orchestrator and the services around them
 */
public class TaskRoutingEngine {

    private static final Logger logger = LoggerFactory.getLogger(TaskRoutingEngine.class);

    static final String REPORT_JOB_ID = "periodic-report";

    private final RoutingConfig config;
    private final TaskStore store;
    private final AuditLog auditLog;
    private final Orchestrator orchestrator;
    private final ApprovalService approvalService;
    private final ReportService reportService;
    private final CronScheduler scheduler;
    private final ActionRegistry actionRegistry;
    private final MetricsCollector metricsCollector;

    public TaskRoutingEngine(RoutingConfig config, TaskStore store, AuditLog auditLog, Orchestrator orchestrator,
                             ApprovalService approvalService, ReportService reportService,
                             CronScheduler scheduler, ActionRegistry actionRegistry,
                             MetricsCollector metricsCollector) {
        this.config = config;
        this.store = store;
        this.auditLog = auditLog;
        this.orchestrator = orchestrator;
        this.approvalService = approvalService;
        this.reportService = reportService;
        this.scheduler = scheduler;
        this.actionRegistry = actionRegistry;
        this.metricsCollector = metricsCollector;
    }

    public RoutingConfig getConfig() { return config; }
    public TaskStore getStore() { return store; }
    public AuditLog getAuditLog() { return auditLog; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public ApprovalService getApprovalService() { return approvalService; }
    public ReportService getReportService() { return reportService; }
    public CronScheduler getScheduler() { return scheduler; }
    public ActionRegistry getActionRegistry() { return actionRegistry; }
    public MetricsCollector getMetricsCollector() { return metricsCollector; }

    /**
     * Start polling and the periodic report
     */
    public void start() {
        RoutingConfig.ReportConfig report = config.getReportConfig();
        orchestrator.start();
        scheduler.scheduleReport(REPORT_JOB_ID, report.getReportCron(), ReportWindow.parse(report.getDefaultWindow()));
        scheduler.start();
        logger.info("Task routing engine started on {}", store.getRoot());
    }

    public void stop() {
        scheduler.stop();
        orchestrator.stop().join();
        logger.info("Task routing engine stopped");
    }

    public boolean isRunning() {
        return orchestrator.isRunning() && scheduler.isRunning();
    }
}
