package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wraps one external action invocation with bounded retries and exponential backoff.
 * <p>
 * Every attempt is audited before control returns: a failed attempt as {@code attempt},
 * a scheduled backoff as {@code retry}, the final failure as {@code failure} and a
 * successful attempt as {@code success}. Backoff sleeps run on the calling worker,
 * so only the task being retried waits.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final ActionInvoker invoker;
    private final AuditLog auditLog;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final MetricsCollector metricsCollector;
    private final FailureClassifier defaultClassifier;
    private final Map<String, FailureClassifier> classifiers = new ConcurrentHashMap<>();
    private volatile AttemptListener attemptListener = AttemptListener.NONE;

    public RetryExecutor(ActionInvoker invoker, AuditLog auditLog, RetryPolicy policy, Sleeper sleeper,
                         MetricsCollector metricsCollector) {
        this(invoker, auditLog, policy, sleeper, metricsCollector, new DefaultFailureClassifier());
    }

    public RetryExecutor(ActionInvoker invoker, AuditLog auditLog, RetryPolicy policy, Sleeper sleeper,
                         MetricsCollector metricsCollector, FailureClassifier defaultClassifier) {
        this.invoker = invoker;
        this.auditLog = auditLog;
        this.policy = policy;
        this.sleeper = sleeper;
        this.metricsCollector = metricsCollector;
        this.defaultClassifier = defaultClassifier;
    }

    /**
     * Registers a classifier for one collaborator. It applies to the action
     * {@code actionName} and to its steps {@code actionName.<step>}.
     */
    public void registerClassifier(String actionName, FailureClassifier classifier) {
        classifiers.put(actionName, classifier);
    }

    public void setAttemptListener(AttemptListener attemptListener) {
        this.attemptListener = attemptListener != null ? attemptListener : AttemptListener.NONE;
    }

    /**
     * Executes with the policy's attempt limit and base delay
     */
    public ExecutionResult execute(String taskId, String actionName, Payload payload) {
        return execute(taskId, actionName, payload, policy.getMaxAttempts(), policy.getBaseDelay());
    }

    /**
     * Invokes the action up to {@code maxAttempts} times. A transient failure sleeps
     * {@code baseDelay * 2^(attempt-1)} (capped) and retries; a permanent failure or
     * the last failed attempt ends the execution. Interruption cancels it.
     */
    public ExecutionResult execute(String taskId, String actionName, Payload payload,
                                   int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        FailureClassifier classifier = classifierFor(actionName);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(taskId, actionName, attempt - 1);
            }
            attemptListener.beforeAttempt(taskId, attempt);
            metricsCollector.recordAttempt();

            String detail;
            FailureClass failureClass;
            try {
                InvocationResponse response = invoker.invoke(actionName, payload);
                if (response.isSuccess()) {
                    auditLog.record(taskId, AuditEventType.SUCCESS,
                        actionName + " succeeded on attempt " + attempt + describe(response.getDetail()),
                        TaskStatus.IN_PROGRESS);
                    logger.info("Action {} for task {} succeeded on attempt {}", actionName, taskId, attempt);
                    return ExecutionResult.success(attempt, response.getDetail());
                }
                detail = response.getDetail();
                failureClass = classifier.classify(actionName, response);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(taskId, actionName, attempt);
            } catch (Exception e) {
                detail = e.getClass().getSimpleName() + ": " + e.getMessage();
                failureClass = classifier.classify(actionName, e);
                logger.debug("Action {} for task {} threw on attempt {}", actionName, taskId, attempt, e);
            }

            String label = failureClass.name().toLowerCase(Locale.ROOT);
            auditLog.record(taskId, AuditEventType.ATTEMPT,
                actionName + " attempt " + attempt + "/" + maxAttempts + " failed (" + label + ")" + describe(detail),
                TaskStatus.IN_PROGRESS);
            logger.warn("Action {} for task {} failed on attempt {}/{} ({}): {}",
                actionName, taskId, attempt, maxAttempts, label, detail);

            if (failureClass == FailureClass.PERMANENT) {
                auditLog.record(taskId, AuditEventType.FAILURE,
                    actionName + " failed permanently" + describe(detail), TaskStatus.FAILED);
                return ExecutionResult.failed(attempt, detail, failureClass);
            }
            if (attempt == maxAttempts) {
                auditLog.record(taskId, AuditEventType.FAILURE,
                    actionName + " exhausted " + maxAttempts + " attempts" + describe(detail), TaskStatus.FAILED);
                return ExecutionResult.failed(attempt, detail, failureClass);
            }

            Duration delay = policy.delayAfter(attempt, baseDelay);
            auditLog.record(taskId, AuditEventType.RETRY,
                actionName + " retrying in " + delay.toMillis() + "ms (attempt " + (attempt + 1) + "/" + maxAttempts + ")",
                TaskStatus.IN_PROGRESS);
            metricsCollector.recordRetry();
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(taskId, actionName, attempt);
            }
        }
        throw new IllegalStateException("Retry loop exited without a result");
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    FailureClassifier classifierFor(String actionName) {
        FailureClassifier exact = classifiers.get(actionName);
        if (exact != null) {
            return exact;
        }
        int separator = actionName.indexOf('.');
        if (separator > 0) {
            FailureClassifier parent = classifiers.get(actionName.substring(0, separator));
            if (parent != null) {
                return parent;
            }
        }
        return defaultClassifier;
    }

    private ExecutionResult cancelled(String taskId, String actionName, int attempts) {
        logger.info("Action {} for task {} cancelled after {} attempts", actionName, taskId, attempts);
        return ExecutionResult.cancelled(attempts);
    }

    private static String describe(String detail) {
        return detail == null || detail.isEmpty() ? "" : ": " + detail;
    }
}
