package com.enterprise.taskrouting.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the task routing engine
 */
public class RoutingConfig {

    private final StoreConfig storeConfig;
    private final RetryConfig retryConfig;
    private final LoopConfig loopConfig;
    private final ExecutorConfig executorConfig;
    private final ApprovalConfig approvalConfig;
    private final ReportConfig reportConfig;
    private final ClassifierConfig classifierConfig;
    private final ActionConfig actionConfig;

    public RoutingConfig(StoreConfig storeConfig, RetryConfig retryConfig, LoopConfig loopConfig,
                         ExecutorConfig executorConfig, ApprovalConfig approvalConfig,
                         ReportConfig reportConfig, ClassifierConfig classifierConfig,
                         ActionConfig actionConfig) {
        this.storeConfig = storeConfig;
        this.retryConfig = retryConfig;
        this.loopConfig = loopConfig;
        this.executorConfig = executorConfig;
        this.approvalConfig = approvalConfig;
        this.reportConfig = reportConfig;
        this.classifierConfig = classifierConfig;
        this.actionConfig = actionConfig;
    }

    public StoreConfig getStoreConfig() { return storeConfig; }
    public RetryConfig getRetryConfig() { return retryConfig; }
    public LoopConfig getLoopConfig() { return loopConfig; }
    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    public ApprovalConfig getApprovalConfig() { return approvalConfig; }
    public ReportConfig getReportConfig() { return reportConfig; }
    public ClassifierConfig getClassifierConfig() { return classifierConfig; }
    public ActionConfig getActionConfig() { return actionConfig; }

    @Override
    public String toString() {
        return "RoutingConfig{" +
                "root=" + storeConfig.getRoot() +
                ", maxAttempts=" + retryConfig.getMaxAttempts() +
                ", baseDelay=" + retryConfig.getBaseDelay() +
                ", maxIterations=" + loopConfig.getMaxIterations() +
                ", workerThreads=" + executorConfig.getWorkerThreads() +
                ", forceAutoApprove=" + approvalConfig.isForceAutoApprove() +
                ", actions=" + actionConfig.getCommands().keySet() +
                ", dryRun=" + actionConfig.isDryRun() +
                '}';
    }

    /**
     * Task store and audit log locations
     */
    public static class StoreConfig {
        private final Path root;
        private final String auditFile;
        private final String briefingsDir;
        private final ZoneId zone;

        public StoreConfig(Path root, String auditFile, String briefingsDir, ZoneId zone) {
            this.root = root;
            this.auditFile = auditFile;
            this.briefingsDir = briefingsDir;
            this.zone = zone;
        }

        public Path getRoot() { return root; }
        public String getAuditFile() { return auditFile; }
        public String getBriefingsDir() { return briefingsDir; }
        public ZoneId getZone() { return zone; }

        public Path getAuditPath() { return root.resolve(auditFile); }
        public Path getBriefingsPath() { return root.resolve(briefingsDir); }
    }

    /**
     * Retry executor configuration
     */
    public static class RetryConfig {
        private final int maxAttempts;
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;

        public RetryConfig(int maxAttempts, Duration baseDelay, double backoffMultiplier, Duration maxDelay) {
            this.maxAttempts = maxAttempts;
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
        }

        public int getMaxAttempts() { return maxAttempts; }
        public Duration getBaseDelay() { return baseDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public Duration getMaxDelay() { return maxDelay; }
    }

    /**
     * Completion loop configuration
     */
    public static class LoopConfig {
        private final int maxIterations;

        public LoopConfig(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public int getMaxIterations() { return maxIterations; }
    }

    /**
     * Worker pool and polling configuration
     */
    public static class ExecutorConfig {
        private final int workerThreads;
        private final Duration pollInterval;
        private final Duration shutdownTimeout;
        private final Duration stuckThreshold;
        private final Duration recoveryGrace;

        public ExecutorConfig(int workerThreads, Duration pollInterval, Duration shutdownTimeout) {
            this(workerThreads, pollInterval, shutdownTimeout,
                Defaults.STUCK_THRESHOLD, Defaults.RECOVERY_GRACE);
        }

        /**
         * @param stuckThreshold how long an in_progress task may go without an update
         *                       before the daemon requeues it
         * @param recoveryGrace  minimum age of a staging file before the daemon resolves it
         */
        public ExecutorConfig(int workerThreads, Duration pollInterval, Duration shutdownTimeout,
                              Duration stuckThreshold, Duration recoveryGrace) {
            this.workerThreads = workerThreads;
            this.pollInterval = pollInterval;
            this.shutdownTimeout = shutdownTimeout;
            this.stuckThreshold = stuckThreshold;
            this.recoveryGrace = recoveryGrace;
        }

        public int getWorkerThreads() { return workerThreads; }
        public Duration getPollInterval() { return pollInterval; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public Duration getStuckThreshold() { return stuckThreshold; }
        public Duration getRecoveryGrace() { return recoveryGrace; }
    }

    /**
     * Approval gate configuration
     */
    public static class ApprovalConfig {
        private final boolean forceAutoApprove;
        private final List<String> sensitiveKeywords;
        private final int maxBatchSize;

        public ApprovalConfig(boolean forceAutoApprove, List<String> sensitiveKeywords, int maxBatchSize) {
            this.forceAutoApprove = forceAutoApprove;
            this.sensitiveKeywords = List.copyOf(sensitiveKeywords);
            this.maxBatchSize = maxBatchSize;
        }

        public boolean isForceAutoApprove() { return forceAutoApprove; }
        public List<String> getSensitiveKeywords() { return sensitiveKeywords; }
        public int getMaxBatchSize() { return maxBatchSize; }
    }

    /**
     * Weekly aggregator and scheduling configuration
     */
    public static class ReportConfig {
        private final String defaultWindow;
        private final Duration staleThreshold;
        private final String reportCron;

        public ReportConfig(String defaultWindow, Duration staleThreshold, String reportCron) {
            this.defaultWindow = defaultWindow;
            this.staleThreshold = staleThreshold;
            this.reportCron = reportCron;
        }

        public String getDefaultWindow() { return defaultWindow; }
        public Duration getStaleThreshold() { return staleThreshold; }
        public String getReportCron() { return reportCron; }
    }

    /**
     * Classifier rule source; a null path means the bundled rules
     */
    public static class ClassifierConfig {
        private final Path rulesPath;

        public ClassifierConfig(Path rulesPath) {
            this.rulesPath = rulesPath;
        }

        public Path getRulesPath() { return rulesPath; }
    }

    /**
     * External action commands, keyed by action name
     */
    public static class ActionConfig {
        private final Map<String, String> commands;
        private final boolean dryRun;
        private final Duration commandTimeout;

        public ActionConfig(Map<String, String> commands, boolean dryRun, Duration commandTimeout) {
            this.commands = Map.copyOf(commands);
            this.dryRun = dryRun;
            this.commandTimeout = commandTimeout;
        }

        public Map<String, String> getCommands() { return commands; }

        /**
         * Whether actions without a command are logged and treated as successful
         */
        public boolean isDryRun() { return dryRun; }
        public Duration getCommandTimeout() { return commandTimeout; }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private StoreConfig storeConfig = Defaults.defaultStoreConfig();
        private RetryConfig retryConfig = Defaults.defaultRetryConfig();
        private LoopConfig loopConfig = Defaults.defaultLoopConfig();
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private ApprovalConfig approvalConfig = Defaults.defaultApprovalConfig();
        private ReportConfig reportConfig = Defaults.defaultReportConfig();
        private ClassifierConfig classifierConfig = Defaults.defaultClassifierConfig();
        private ActionConfig actionConfig = Defaults.defaultActionConfig();

        public Builder storeConfig(StoreConfig storeConfig) {
            this.storeConfig = storeConfig;
            return this;
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }

        public Builder loopConfig(LoopConfig loopConfig) {
            this.loopConfig = loopConfig;
            return this;
        }

        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }

        public Builder approvalConfig(ApprovalConfig approvalConfig) {
            this.approvalConfig = approvalConfig;
            return this;
        }

        public Builder reportConfig(ReportConfig reportConfig) {
            this.reportConfig = reportConfig;
            return this;
        }

        public Builder classifierConfig(ClassifierConfig classifierConfig) {
            this.classifierConfig = classifierConfig;
            return this;
        }

        public Builder actionConfig(ActionConfig actionConfig) {
            this.actionConfig = actionConfig;
            return this;
        }

        /**
         * Shortcut for a store rooted at {@code root} with default file names
         */
        public Builder root(Path root) {
            this.storeConfig = new StoreConfig(root, storeConfig.getAuditFile(),
                storeConfig.getBriefingsDir(), storeConfig.getZone());
            return this;
        }

        public RoutingConfig build() {
            return new RoutingConfig(storeConfig, retryConfig, loopConfig, executorConfig,
                                     approvalConfig, reportConfig, classifierConfig, actionConfig);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static final List<String> SENSITIVE_KEYWORDS =
            List.of("payment", "password", "bank", "contract", "legal", "wire transfer", "invoice");
        public static final Duration STUCK_THRESHOLD = Duration.ofMinutes(30);
        public static final Duration RECOVERY_GRACE = Duration.ofMinutes(1);

        public static StoreConfig defaultStoreConfig() {
            return new StoreConfig(Paths.get("vault"), "audit_log.jsonl", "briefings", ZoneId.systemDefault());
        }

        public static RetryConfig defaultRetryConfig() {
            return new RetryConfig(3, Duration.ofSeconds(2), 2.0, Duration.ofMinutes(5));
        }

        public static LoopConfig defaultLoopConfig() {
            return new LoopConfig(10);
        }

        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(4, Duration.ofSeconds(30), Duration.ofSeconds(30));
        }

        public static ApprovalConfig defaultApprovalConfig() {
            return new ApprovalConfig(false, SENSITIVE_KEYWORDS, 10);
        }

        public static ReportConfig defaultReportConfig() {
            return new ReportConfig("weekly", Duration.ofHours(48), "0 8 * * 0");
        }

        public static ClassifierConfig defaultClassifierConfig() {
            return new ClassifierConfig(null);
        }

        public static ActionConfig defaultActionConfig() {
            return new ActionConfig(Map.of(), true, Duration.ofMinutes(2));
        }
    }
}
