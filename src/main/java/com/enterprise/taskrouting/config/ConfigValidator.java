package com.enterprise.taskrouting.config;

import com.enterprise.taskrouting.report.ReportWindow;
import it.sauronsoftware.cron4j.SchedulingPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates task routing configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(RoutingConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateStoreConfig(config.getStoreConfig(), errors);
        validateRetryConfig(config.getRetryConfig(), errors);
        validateLoopConfig(config.getLoopConfig(), errors);
        validateExecutorConfig(config.getExecutorConfig(), errors);
        validateApprovalConfig(config.getApprovalConfig(), errors);
        validateReportConfig(config.getReportConfig(), errors);
        validateActionConfig(config.getActionConfig(), errors);

        return errors;
    }

    private void validateStoreConfig(RoutingConfig.StoreConfig config, List<ValidationError> errors) {
        if (config.getRoot() == null) {
            errors.add(new ValidationError("store.root", "Store root directory is required"));
        }
        if (config.getAuditFile() == null || config.getAuditFile().trim().isEmpty()) {
            errors.add(new ValidationError("store.audit-file", "Audit log file name is required"));
        }
        if (config.getBriefingsDir() == null || config.getBriefingsDir().trim().isEmpty()) {
            errors.add(new ValidationError("store.briefings-dir", "Briefings directory name is required"));
        }
        if (config.getZone() == null) {
            errors.add(new ValidationError("store.zone", "Time zone is required"));
        }
    }

    private void validateRetryConfig(RoutingConfig.RetryConfig config, List<ValidationError> errors) {
        if (config.getMaxAttempts() < 1) {
            errors.add(new ValidationError("retry.max-attempts",
                "Maximum attempts must be at least 1"));
        }

        if (config.getBaseDelay().isNegative()) {
            errors.add(new ValidationError("retry.base-delay",
                "Base delay cannot be negative"));
        }

        if (config.getBackoffMultiplier() < 1.0) {
            errors.add(new ValidationError("retry.backoff-multiplier",
                "Backoff multiplier must be at least 1.0"));
        }

        if (config.getMaxDelay().isNegative()) {
            errors.add(new ValidationError("retry.max-delay",
                "Maximum delay cannot be negative"));
        }

        if (config.getBaseDelay().compareTo(config.getMaxDelay()) > 0) {
            errors.add(new ValidationError("retry.delay-range",
                "Base delay cannot be greater than maximum delay"));
        }
    }

    private void validateLoopConfig(RoutingConfig.LoopConfig config, List<ValidationError> errors) {
        if (config.getMaxIterations() < 1) {
            errors.add(new ValidationError("loop.max-iterations",
                "Maximum iterations must be at least 1"));
        }
    }

    private void validateExecutorConfig(RoutingConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config.getWorkerThreads() <= 0) {
            errors.add(new ValidationError("executor.worker-threads",
                "Worker thread count must be greater than 0"));
        }

        if (config.getPollInterval().isNegative() || config.getPollInterval().isZero()) {
            errors.add(new ValidationError("executor.poll-interval",
                "Poll interval must be positive"));
        }

        if (config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("executor.shutdown-timeout",
                "Shutdown timeout cannot be negative"));
        }

        if (config.getStuckThreshold().isNegative() || config.getStuckThreshold().isZero()) {
            errors.add(new ValidationError("executor.stuck-threshold",
                "Stuck threshold must be positive"));
        }

        if (config.getRecoveryGrace().isNegative()) {
            errors.add(new ValidationError("executor.recovery-grace",
                "Recovery grace period cannot be negative"));
        }
    }

    private void validateApprovalConfig(RoutingConfig.ApprovalConfig config, List<ValidationError> errors) {
        if (config.getMaxBatchSize() < 0) {
            errors.add(new ValidationError("approval.max-batch-size",
                "Maximum batch size cannot be negative"));
        }
    }

    private void validateReportConfig(RoutingConfig.ReportConfig config, List<ValidationError> errors) {
        try {
            ReportWindow.parse(config.getDefaultWindow());
        } catch (IllegalArgumentException e) {
            errors.add(new ValidationError("report.default-window", e.getMessage()));
        }

        if (config.getStaleThreshold().isNegative()) {
            errors.add(new ValidationError("report.stale-threshold",
                "Staleness threshold cannot be negative"));
        }

        if (!SchedulingPattern.validate(config.getReportCron())) {
            errors.add(new ValidationError("report.cron",
                "Invalid cron pattern: " + config.getReportCron()));
        }
    }

    private void validateActionConfig(RoutingConfig.ActionConfig config, List<ValidationError> errors) {
        config.getCommands().forEach((action, command) -> {
            if (command == null || command.trim().isEmpty()) {
                errors.add(new ValidationError("actions.commands." + action, "Command cannot be empty"));
            }
        });

        if (config.getCommandTimeout().isNegative() || config.getCommandTimeout().isZero()) {
            errors.add(new ValidationError("actions.command-timeout",
                "Command timeout must be positive"));
        }
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
