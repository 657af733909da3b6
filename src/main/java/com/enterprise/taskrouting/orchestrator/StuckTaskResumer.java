package com.enterprise.taskrouting.orchestrator;

import com.enterprise.taskrouting.audit.AuditEventType;
import com.enterprise.taskrouting.audit.AuditLog;
import com.enterprise.taskrouting.core.Task;
import com.enterprise.taskrouting.core.TaskStatus;
import com.enterprise.taskrouting.exception.IllegalTransitionException;
import com.enterprise.taskrouting.exception.TaskNotFoundException;
import com.enterprise.taskrouting.monitoring.MetricsCollector;
import com.enterprise.taskrouting.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

/**
 * Daemon housekeeping run before each poll pass.
 * <p>
 * First resolves store transitions a crashed process left half done, then returns
 * tasks stranded in {@code in_progress} to a resumable partition. A task is stranded
 * when no worker of this process holds it and it has gone without an update for the
 * stuck threshold, as happens after a crash or a worker abandoned at shutdown.
 * The threshold must exceed the longest backoff plus action timeout, since workers
 * of other processes sharing the root are only visible through their updates.
 */
public class StuckTaskResumer {

    private static final Logger logger = LoggerFactory.getLogger(StuckTaskResumer.class);

    private final TaskStore store;
    private final AuditLog auditLog;
    private final MetricsCollector metricsCollector;
    private final Clock clock;
    private final Duration stuckThreshold;
    private final Duration recoveryGrace;

    public StuckTaskResumer(TaskStore store, AuditLog auditLog, MetricsCollector metricsCollector,
                            Clock clock, Duration stuckThreshold, Duration recoveryGrace) {
        this.store = store;
        this.auditLog = auditLog;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
        this.stuckThreshold = stuckThreshold;
        this.recoveryGrace = recoveryGrace;
    }

    /**
     * @param heldLocally true for task ids a worker of this process is processing
     * @return the number of tasks requeued
     */
    public int resume(Predicate<String> heldLocally) {
        int recovered = store.recover(recoveryGrace);
        if (recovered > 0) {
            logger.info("Resolved {} interrupted store transitions", recovered);
        }

        Instant cutoff = clock.instant().minus(stuckThreshold);
        int resumed = 0;
        int failed = 0;
        for (Task task : store.list(TaskStatus.IN_PROGRESS)) {
            if (heldLocally.test(task.getId())) {
                continue;
            }
            Instant lastUpdate = task.getUpdatedAt();
            if (lastUpdate.isAfter(cutoff)) {
                continue;
            }
            try {
                Task requeued = store.requeue(task.getId());
                auditLog.record(task.getId(), AuditEventType.MOVED,
                    "stuck in in_progress since " + lastUpdate + ", requeued to " + requeued.getStatus().wireName(),
                    requeued.getStatus());
                metricsCollector.recordResumed(task.getId());
                logger.warn("Task {} was stuck in in_progress since {}, requeued to {}",
                    task.getId(), lastUpdate, requeued.getStatus());
                resumed++;
            } catch (TaskNotFoundException | IllegalTransitionException e) {
                logger.info("Stuck task {} changed state before it could be resumed: {}", task.getId(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Resuming stuck task {} failed", task.getId(), e);
                failed++;
            }
        }

        if (resumed > 0 || failed > 0) {
            logger.info("Stuck task pass: {} resumed, {} failed", resumed, failed);
        }
        return resumed;
    }
}
