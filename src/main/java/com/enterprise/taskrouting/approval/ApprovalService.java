package com.enterprise.taskrouting.approval;

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

/**
 * Entry point for external approval signals on tasks held in {@code needs_action}.
 * Approval is asynchronous: the task waits in the store, and no thread blocks
 * until a decision arrives.
 */
public class ApprovalService {

    private static final Logger logger = LoggerFactory.getLogger(ApprovalService.class);

    static final String DENIED_REASON = "approval_denied";

    private final TaskStore store;
    private final AuditLog auditLog;
    private final MetricsCollector metricsCollector;
    private volatile ApprovalListener listener;

    public ApprovalService(TaskStore store, AuditLog auditLog, MetricsCollector metricsCollector) {
        this.store = store;
        this.auditLog = auditLog;
        this.metricsCollector = metricsCollector;
    }

    /**
     * Registers the component that resumes approved tasks
     */
    public void setListener(ApprovalListener listener) {
        this.listener = listener;
    }

    /**
     * Records a human decision. {@code true} marks the task approved and hands it
     * to the listener; {@code false} fails it with reason {@code approval_denied}.
     *
     * @throws IllegalTransitionException if the task is not awaiting approval
     */
    public Task decide(String id, boolean approved) throws TaskNotFoundException, IllegalTransitionException {
        if (approved) {
            Task task = store.update(id, TaskStatus.NEEDS_ACTION, t -> t.toBuilder().approved(Boolean.TRUE).build());
            auditLog.record(id, AuditEventType.APPROVAL_GRANTED, "approved by operator", task.getStatus());
            metricsCollector.recordApprovalGranted();
            logger.info("Task {} approved", id);

            ApprovalListener current = listener;
            if (current != null) {
                current.onApproved(task);
            }
            return task;
        }

        store.update(id, TaskStatus.NEEDS_ACTION, t -> t.toBuilder().approved(Boolean.FALSE).build());
        Task failed = store.fail(id, DENIED_REASON);
        auditLog.record(id, AuditEventType.APPROVAL_DENIED, "denied by operator", failed.getStatus());
        metricsCollector.recordApprovalDenied();
        logger.info("Task {} denied", id);
        return failed;
    }
}
