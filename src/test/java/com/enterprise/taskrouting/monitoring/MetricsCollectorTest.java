package com.enterprise.taskrouting.monitoring;

import com.enterprise.taskrouting.core.Source;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskImpl;
import com.enterprise.taskrouting.core.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector metricsCollector;
    private Task task;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsCollector = new MetricsCollector(registry);
        task = TaskImpl.builder()
            .id("20260302_090000_gmail_a1b2c3")
            .source(Source.GMAIL)
            .status(TaskStatus.DONE)
            .createdAt(Instant.parse("2026-03-02T09:00:00Z"))
            .build();
    }

    @Test
    void testCounters() {
        metricsCollector.recordIntake(task);
        metricsCollector.recordApprovalRequested();
        metricsCollector.recordAttempt();
        metricsCollector.recordAttempt();
        metricsCollector.recordRetry();
        metricsCollector.recordCompleted(task, 120);
        metricsCollector.recordFailed(task, 40);
        metricsCollector.updateInFlight(3);

        Map<String, Object> metrics = metricsCollector.getMetrics();
        assertEquals(1.0, metrics.get("tasks.intake"));
        assertEquals(1.0, metrics.get("approvals.requested"));
        assertEquals(2.0, metrics.get("actions.attempts"));
        assertEquals(1.0, metrics.get("actions.retries"));
        assertEquals(1.0, metrics.get("tasks.completed"));
        assertEquals(1.0, metrics.get("tasks.failed"));
        assertEquals(120.0, metrics.get("task.processing.time.max"));
        assertEquals(3L, metrics.get("tasks.inflight"));
        assertEquals(3.0, registry.get("taskrouting.tasks.inflight").gauge().value());
    }

    @Test
    void testRouteCountersAreTagged() {
        metricsCollector.recordClassified(task, "email_reply(business)");
        metricsCollector.recordClassified(task, "email_reply(business)");
        metricsCollector.recordClassified(task, "default(personal)");

        assertEquals(2.0, registry.get("taskrouting.task.route").tag("route", "email_reply(business)").counter().count());
        assertEquals(1.0, registry.get("taskrouting.task.route").tag("route", "default(personal)").counter().count());
        assertEquals(3.0, registry.get("taskrouting.tasks.classified").counter().count());
    }
}
