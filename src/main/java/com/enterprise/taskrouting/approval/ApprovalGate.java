package com.enterprise.taskrouting.approval;

import com.enterprise.taskrouting.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a classified task needs human confirmation before it runs.
 * Rule evaluation is a pure function of the task, the context snapshot and the policy.
 */
public class ApprovalGate {

    private static final Logger logger = LoggerFactory.getLogger(ApprovalGate.class);

    private final ApprovalPolicy policy;
    private final boolean forceAutoApprove;

    public ApprovalGate(ApprovalPolicy policy, boolean forceAutoApprove) {
        this.policy = policy;
        this.forceAutoApprove = forceAutoApprove;
    }

    /**
     * Evaluates the policy in order; first match wins, no match requires approval.
     *
     * @throws IllegalStateException if the task has not been classified
     */
    public static ApprovalDecision requiresApproval(Task task, ApprovalContext context, ApprovalPolicy policy) {
        if (!task.isClassified()) {
            throw new IllegalStateException("Task " + task.getId() + " must be classified before the approval gate");
        }
        for (ApprovalRule rule : policy.getRules()) {
            if (rule.matches(task, context)) {
                return rule.toDecision(task);
            }
        }
        return ApprovalDecision.denyByDefault();
    }

    /**
     * Applies the force-auto-approve override, otherwise evaluates the policy
     */
    public ApprovalDecision evaluate(Task task, ApprovalContext context) {
        if (forceAutoApprove) {
            logger.warn("Approval gate bypassed for task {} by force-auto-approve override", task.getId());
            return ApprovalDecision.forced("approval gate bypassed by force-auto-approve override");
        }
        return requiresApproval(task, context, policy);
    }

    public boolean isForceAutoApprove() {
        return forceAutoApprove;
    }
}
