package com.enterprise.taskrouting.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads {@link RoutingConfig} from a {@code task-routing.yml} file (or the copy
 * bundled on the classpath), then applies environment overrides.
 * Keys missing from the file keep their defaults.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "task-routing.yml";

    public static final String ENV_HOME = "TASKROUTING_HOME";
    public static final String ENV_AUTO_APPROVE = "TASKROUTING_AUTO_APPROVE";
    public static final String ENV_MAX_ATTEMPTS = "TASKROUTING_MAX_ATTEMPTS";
    public static final String ENV_MAX_ITERATIONS = "TASKROUTING_MAX_ITERATIONS";

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    public ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads from {@code file}, or from the classpath resource when {@code file} is null
     *
     * @throws IllegalArgumentException if the file cannot be read or the result fails validation
     */
    public RoutingConfig load(Path file) {
        JsonNode root = file != null ? readFile(file) : readClasspath();
        RoutingConfig config = applyEnvironment(fromTree(root));

        List<ConfigValidator.ValidationError> errors = new ConfigValidator().validate(config);
        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
        logger.info("Loaded configuration: {}", config);
        return config;
    }

    RoutingConfig fromTree(JsonNode root) {
        RoutingConfig.StoreConfig storeDefaults = RoutingConfig.Defaults.defaultStoreConfig();
        JsonNode store = root.path("store");
        RoutingConfig.StoreConfig storeConfig = new RoutingConfig.StoreConfig(
            store.hasNonNull("root") ? Paths.get(store.get("root").asText()) : storeDefaults.getRoot(),
            text(store, "audit-file", storeDefaults.getAuditFile()),
            text(store, "briefings-dir", storeDefaults.getBriefingsDir()),
            store.hasNonNull("zone") ? ZoneId.of(store.get("zone").asText()) : storeDefaults.getZone());

        RoutingConfig.RetryConfig retryDefaults = RoutingConfig.Defaults.defaultRetryConfig();
        JsonNode retry = root.path("retry");
        RoutingConfig.RetryConfig retryConfig = new RoutingConfig.RetryConfig(
            retry.path("max-attempts").asInt(retryDefaults.getMaxAttempts()),
            duration(retry, "base-delay", retryDefaults.getBaseDelay()),
            retry.path("backoff-multiplier").asDouble(retryDefaults.getBackoffMultiplier()),
            duration(retry, "max-delay", retryDefaults.getMaxDelay()));

        RoutingConfig.LoopConfig loopConfig = new RoutingConfig.LoopConfig(
            root.path("loop").path("max-iterations").asInt(RoutingConfig.Defaults.defaultLoopConfig().getMaxIterations()));

        RoutingConfig.ExecutorConfig executorDefaults = RoutingConfig.Defaults.defaultExecutorConfig();
        JsonNode executor = root.path("executor");
        RoutingConfig.ExecutorConfig executorConfig = new RoutingConfig.ExecutorConfig(
            executor.path("worker-threads").asInt(executorDefaults.getWorkerThreads()),
            duration(executor, "poll-interval", executorDefaults.getPollInterval()),
            duration(executor, "shutdown-timeout", executorDefaults.getShutdownTimeout()),
            duration(executor, "stuck-threshold", executorDefaults.getStuckThreshold()),
            duration(executor, "recovery-grace", executorDefaults.getRecoveryGrace()));

        RoutingConfig.ApprovalConfig approvalDefaults = RoutingConfig.Defaults.defaultApprovalConfig();
        JsonNode approval = root.path("approval");
        RoutingConfig.ApprovalConfig approvalConfig = new RoutingConfig.ApprovalConfig(
            approval.path("force-auto-approve").asBoolean(approvalDefaults.isForceAutoApprove()),
            list(approval, "sensitive-keywords", approvalDefaults.getSensitiveKeywords()),
            approval.path("max-batch-size").asInt(approvalDefaults.getMaxBatchSize()));

        RoutingConfig.ReportConfig reportDefaults = RoutingConfig.Defaults.defaultReportConfig();
        JsonNode report = root.path("report");
        RoutingConfig.ReportConfig reportConfig = new RoutingConfig.ReportConfig(
            text(report, "default-window", reportDefaults.getDefaultWindow()),
            duration(report, "stale-threshold", reportDefaults.getStaleThreshold()),
            text(report, "cron", reportDefaults.getReportCron()));

        JsonNode classifier = root.path("classifier");
        RoutingConfig.ClassifierConfig classifierConfig = new RoutingConfig.ClassifierConfig(
            classifier.hasNonNull("rules-path") && !classifier.get("rules-path").asText().isBlank()
                ? Paths.get(classifier.get("rules-path").asText())
                : null);

        RoutingConfig.ActionConfig actionDefaults = RoutingConfig.Defaults.defaultActionConfig();
        JsonNode actions = root.path("actions");
        Map<String, String> commands = new LinkedHashMap<>();
        actions.path("commands").fields().forEachRemaining(entry -> commands.put(entry.getKey(), entry.getValue().asText()));
        RoutingConfig.ActionConfig actionConfig = new RoutingConfig.ActionConfig(
            commands,
            actions.path("dry-run").asBoolean(actionDefaults.isDryRun()),
            duration(actions, "command-timeout", actionDefaults.getCommandTimeout()));

        return new RoutingConfig(storeConfig, retryConfig, loopConfig, executorConfig,
                                 approvalConfig, reportConfig, classifierConfig, actionConfig);
    }

    RoutingConfig applyEnvironment(RoutingConfig config) {
        RoutingConfig.Builder builder = RoutingConfig.builder()
            .storeConfig(config.getStoreConfig())
            .retryConfig(config.getRetryConfig())
            .loopConfig(config.getLoopConfig())
            .executorConfig(config.getExecutorConfig())
            .approvalConfig(config.getApprovalConfig())
            .reportConfig(config.getReportConfig())
            .classifierConfig(config.getClassifierConfig())
            .actionConfig(config.getActionConfig());

        String home = environment.get(ENV_HOME);
        if (home != null && !home.isBlank()) {
            builder.root(Paths.get(home));
        }

        String autoApprove = environment.get(ENV_AUTO_APPROVE);
        if (autoApprove != null && !autoApprove.isBlank()) {
            RoutingConfig.ApprovalConfig approval = config.getApprovalConfig();
            builder.approvalConfig(new RoutingConfig.ApprovalConfig(
                Boolean.parseBoolean(autoApprove.trim()), approval.getSensitiveKeywords(), approval.getMaxBatchSize()));
        }

        String maxAttempts = environment.get(ENV_MAX_ATTEMPTS);
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            RoutingConfig.RetryConfig retry = config.getRetryConfig();
            builder.retryConfig(new RoutingConfig.RetryConfig(
                parseInt(ENV_MAX_ATTEMPTS, maxAttempts), retry.getBaseDelay(),
                retry.getBackoffMultiplier(), retry.getMaxDelay()));
        }

        String maxIterations = environment.get(ENV_MAX_ITERATIONS);
        if (maxIterations != null && !maxIterations.isBlank()) {
            builder.loopConfig(new RoutingConfig.LoopConfig(parseInt(ENV_MAX_ITERATIONS, maxIterations)));
        }

        return builder.build();
    }

    /**
     * Parses {@code 500ms}, {@code 2s}, {@code 5m}, {@code 48h}, {@code 7d} or an ISO-8601 duration
     */
    public static Duration parseDuration(String value) {
        String text = value.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = SHORT_DURATION.matcher(text);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "ms":
                    return Duration.ofMillis(amount);
                case "s":
                    return Duration.ofSeconds(amount);
                case "m":
                    return Duration.ofMinutes(amount);
                case "h":
                    return Duration.ofHours(amount);
                default:
                    return Duration.ofDays(amount);
            }
        }
        try {
            return Duration.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (java.time.format.DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration: " + value, e);
        }
    }

    private JsonNode readFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return orEmpty(yamlMapper.readTree(in));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read configuration file " + file, e);
        }
    }

    private JsonNode readClasspath() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.info("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return MissingNode.getInstance();
            }
            return orEmpty(yamlMapper.readTree(in));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read classpath configuration " + DEFAULT_RESOURCE, e);
        }
    }

    private static JsonNode orEmpty(JsonNode node) {
        return node != null ? node : MissingNode.getInstance();
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }

    private static Duration duration(JsonNode node, String field, Duration defaultValue) {
        return node.hasNonNull(field) ? parseDuration(node.get(field).asText()) : defaultValue;
    }

    private static List<String> list(JsonNode node, String field, List<String> defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return defaultValue;
        }
        List<String> result = new ArrayList<>();
        value.forEach(element -> result.add(element.asText()));
        return result;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, was " + value, e);
        }
    }
}
