package com.enterprise.taskrouting.monitoring;

import com.enterprise.taskrouting.core.Task;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for the task routing engine
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> routeCounters = new ConcurrentHashMap<>();

    private final Counter tasksIntake;
    private final Counter tasksClassified;
    private final Counter approvalsRequested;
    private final Counter approvalsGranted;
    private final Counter approvalsDenied;
    private final Counter actionAttempts;
    private final Counter actionRetries;
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksQuarantined;
    private final Counter tasksCancelled;
    private final Counter tasksResumed;

    private final Timer taskProcessingTime;

    private final AtomicLong inFlightTasks = new AtomicLong(0);

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tasksIntake = counter("taskrouting.tasks.intake", "Task documents registered from intake");
        this.tasksClassified = counter("taskrouting.tasks.classified", "Tasks classified");
        this.approvalsRequested = counter("taskrouting.approvals.requested", "Tasks held for human approval");
        this.approvalsGranted = counter("taskrouting.approvals.granted", "Approvals granted, including overrides");
        this.approvalsDenied = counter("taskrouting.approvals.denied", "Approvals denied");
        this.actionAttempts = counter("taskrouting.actions.attempts", "External action attempts");
        this.actionRetries = counter("taskrouting.actions.retries", "External action retries scheduled");
        this.tasksCompleted = counter("taskrouting.tasks.completed", "Tasks completed successfully");
        this.tasksFailed = counter("taskrouting.tasks.failed", "Tasks that failed");
        this.tasksQuarantined = counter("taskrouting.tasks.quarantined", "Malformed documents quarantined");
        this.tasksCancelled = counter("taskrouting.tasks.cancelled", "In-flight tasks cancelled and requeued");
        this.tasksResumed = counter("taskrouting.tasks.resumed", "Stuck in_progress tasks requeued by the daemon");

        this.taskProcessingTime = Timer.builder("taskrouting.task.processing.time")
            .description("Time from claim to terminal state")
            .register(meterRegistry);

        Gauge.builder("taskrouting.tasks.inflight", inFlightTasks, AtomicLong::get)
            .description("Number of tasks currently being processed")
            .register(meterRegistry);

        logger.info("MetricsCollector initialized");
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(meterRegistry);
    }

    public void recordIntake(Task task) {
        tasksIntake.increment();
        logger.debug("Recorded intake: {}", task.getId());
    }

    public void recordClassified(Task task, String route) {
        tasksClassified.increment();
        routeCounters.computeIfAbsent(route, key ->
            Counter.builder("taskrouting.task.route")
                .tag("route", key)
                .description("Tasks classified by handler route")
                .register(meterRegistry)
        ).increment();
    }

    public void recordApprovalRequested() {
        approvalsRequested.increment();
    }

    public void recordApprovalGranted() {
        approvalsGranted.increment();
    }

    public void recordApprovalDenied() {
        approvalsDenied.increment();
    }

    public void recordAttempt() {
        actionAttempts.increment();
    }

    public void recordRetry() {
        actionRetries.increment();
    }

    public void recordCompleted(Task task, long processingTimeMs) {
        tasksCompleted.increment();
        taskProcessingTime.record(processingTimeMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded completion: {} in {}ms", task.getId(), processingTimeMs);
    }

    public void recordFailed(Task task, long processingTimeMs) {
        tasksFailed.increment();
        taskProcessingTime.record(processingTimeMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded failure: {} - {}", task.getId(), task.getFailureReason().orElse(""));
    }

    public void recordQuarantined() {
        tasksQuarantined.increment();
    }

    public void recordCancelled(String taskId) {
        tasksCancelled.increment();
        logger.debug("Recorded cancellation: {}", taskId);
    }

    public void recordResumed(String taskId) {
        tasksResumed.increment();
        logger.debug("Recorded stuck task resumption: {}", taskId);
    }

    public void updateInFlight(int count) {
        inFlightTasks.set(count);
    }

    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("tasks.intake", tasksIntake.count());
        metrics.put("tasks.classified", tasksClassified.count());
        metrics.put("approvals.requested", approvalsRequested.count());
        metrics.put("approvals.granted", approvalsGranted.count());
        metrics.put("approvals.denied", approvalsDenied.count());
        metrics.put("actions.attempts", actionAttempts.count());
        metrics.put("actions.retries", actionRetries.count());
        metrics.put("tasks.completed", tasksCompleted.count());
        metrics.put("tasks.failed", tasksFailed.count());
        metrics.put("tasks.quarantined", tasksQuarantined.count());
        metrics.put("tasks.cancelled", tasksCancelled.count());
        metrics.put("tasks.resumed", tasksResumed.count());
        metrics.put("task.processing.time.mean", taskProcessingTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("task.processing.time.max", taskProcessingTime.max(TimeUnit.MILLISECONDS));
        metrics.put("tasks.inflight", inFlightTasks.get());

        return metrics;
    }
}
