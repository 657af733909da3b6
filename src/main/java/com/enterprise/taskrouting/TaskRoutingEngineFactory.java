package com.enterprise.taskrouting;

import com.enterprise.taskrouting.approval.ApprovalGate;
import com.enterprise.taskrouting.approval.ApprovalPolicy;
import com.enterprise.taskrouting.approval.ApprovalService;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.audit.JsonLinesAuditLog;
import com.enterprise.taskrouting.classify.ClassifierRules;
import com.enterprise.taskrouting.classify.DomainClassifier;
import com.enterprise.taskrouting.config.ConfigValidator;
import com.enterprise.taskrouting.config.RoutingConfig;
import com.enterprise.taskrouting.monitoring.MetricsCollector;
import com.enterprise.taskrouting.orchestrator.OrchestratorImpl;
import com.enterprise.taskrouting.orchestrator.StuckTaskResumer;
import com.enterprise.taskrouting.orchestrator.WorkerPool;
import com.enterprise.taskrouting.report.BriefingRenderer;
import com.enterprise.taskrouting.report.ReportService;
import com.enterprise.taskrouting.report.WeeklyAggregator;
import com.enterprise.taskrouting.retry.ActionInvoker;
import com.enterprise.taskrouting.retry.ActionRegistry;
import com.enterprise.taskrouting.retry.CommandActionInvoker;
import com.enterprise.taskrouting.retry.DryRunActionInvoker;
import com.enterprise.taskrouting.retry.RetryExecutor;
import com.enterprise.taskrouting.retry.RetryPolicy;
import com.enterprise.taskrouting.retry.Sleeper;
import com.enterprise.taskrouting.scheduler.CronScheduler;
import com.enterprise.taskrouting.store.FileTaskStore;
import com.enterprise.taskrouting.store.TaskStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;

/**
 * Factory for creating and wiring the task routing engine
 */
public class TaskRoutingEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(TaskRoutingEngineFactory.class);

    /**
     * Create an engine with default configuration
     */
    public static TaskRoutingEngine createDefault() {
        return create(RoutingConfig.builder().build());
    }

    /**
     * Create an engine with actions resolved from the configured commands
     */
    public static TaskRoutingEngine create(RoutingConfig config) {
        return create(config, null, Sleeper.SYSTEM, Clock.system(config.getStoreConfig().getZone()));
    }

    /**
     * Create an engine around a specific invoker; a null invoker leaves only the configured commands
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static TaskRoutingEngine create(RoutingConfig config, ActionInvoker fallbackInvoker,
                                           Sleeper sleeper, Clock clock) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }

        logger.info("Creating TaskRoutingEngine with configuration: {}", config);

        RoutingConfig.StoreConfig storeConfig = config.getStoreConfig();
        TaskStore store = new FileTaskStore(storeConfig.getRoot(), clock);
        AuditLog auditLog = new JsonLinesAuditLog(storeConfig.getAuditPath(), clock);
        MetricsCollector metricsCollector = new MetricsCollector(new SimpleMeterRegistry());

        DomainClassifier classifier = new DomainClassifier(loadRules(config.getClassifierConfig()));

        RoutingConfig.ApprovalConfig approvalConfig = config.getApprovalConfig();
        ApprovalGate gate = new ApprovalGate(
            ApprovalPolicy.defaultPolicy(approvalConfig.getSensitiveKeywords(), approvalConfig.getMaxBatchSize()),
            approvalConfig.isForceAutoApprove());

        ActionRegistry actionRegistry = createActionRegistry(config.getActionConfig(), fallbackInvoker);
        RetryExecutor retryExecutor = new RetryExecutor(actionRegistry, auditLog, createRetryPolicy(config.getRetryConfig()),
            sleeper, metricsCollector);

        RoutingConfig.ExecutorConfig executorConfig = config.getExecutorConfig();
        StuckTaskResumer resumer = new StuckTaskResumer(store, auditLog, metricsCollector, clock,
            executorConfig.getStuckThreshold(), executorConfig.getRecoveryGrace());
        OrchestratorImpl orchestrator = new OrchestratorImpl(store, auditLog, classifier, gate, retryExecutor,
            new WorkerPool(executorConfig.getWorkerThreads()), metricsCollector,
            config.getLoopConfig().getMaxIterations(), executorConfig.getPollInterval(),
            executorConfig.getShutdownTimeout(), resumer);

        ApprovalService approvalService = new ApprovalService(store, auditLog, metricsCollector);
        approvalService.setListener(orchestrator);

        WeeklyAggregator aggregator = new WeeklyAggregator(store, auditLog,
            config.getReportConfig().getStaleThreshold(), clock);
        ReportService reportService = new ReportService(aggregator, new BriefingRenderer(storeConfig.getZone()),
            auditLog, storeConfig.getBriefingsPath());
        CronScheduler scheduler = new CronScheduler(reportService, storeConfig.getZone());

        logger.info("TaskRoutingEngine created successfully");
        return new TaskRoutingEngine(config, store, auditLog, orchestrator, approvalService, reportService,
            scheduler, actionRegistry, metricsCollector);
    }

    static RetryPolicy createRetryPolicy(RoutingConfig.RetryConfig config) {
        return RetryPolicy.builder()
            .maxAttempts(config.getMaxAttempts())
            .baseDelay(config.getBaseDelay())
            .backoffMultiplier(config.getBackoffMultiplier())
            .maxDelay(config.getMaxDelay())
            .build();
    }

    static ActionRegistry createActionRegistry(RoutingConfig.ActionConfig config, ActionInvoker fallbackInvoker) {
        ActionRegistry registry = new ActionRegistry();
        config.getCommands().forEach((action, commandLine) ->
            registry.register(action, CommandActionInvoker.ofCommandLine(commandLine, config.getCommandTimeout())));
        if (fallbackInvoker != null) {
            registry.setFallback(fallbackInvoker);
        } else if (config.isDryRun()) {
            registry.setFallback(new DryRunActionInvoker());
        }
        return registry;
    }

    private static ClassifierRules loadRules(RoutingConfig.ClassifierConfig config) {
        if (config.getRulesPath() == null) {
            return ClassifierRules.loadDefault();
        }
        try {
            return ClassifierRules.load(config.getRulesPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load classifier rules from " + config.getRulesPath(), e);
        }
    }
}
