package com.enterprise.taskrouting.approval;

/**
 * Outcome of evaluating the approval gate for one task
 */
public final class ApprovalDecision {

    private static final String OVERRIDE_RULE = "override";
    private static final String DEFAULT_RULE = "default";

    private final boolean requiresApproval;
    private final String rule;
    private final String reason;
    private final boolean override;

    private ApprovalDecision(boolean requiresApproval, String rule, String reason, boolean override) {
        this.requiresApproval = requiresApproval;
        this.rule = rule;
        this.reason = reason;
        this.override = override;
    }

    public static ApprovalDecision require(String rule, String reason) {
        return new ApprovalDecision(true, rule, reason, false);
    }

    public static ApprovalDecision autoApprove(String rule, String reason) {
        return new ApprovalDecision(false, rule, reason, false);
    }

    /**
     * No rule matched: approval is required
     */
    public static ApprovalDecision denyByDefault() {
        return new ApprovalDecision(true, DEFAULT_RULE, "no auto-approve rule matched", false);
    }

    /**
     * Gate bypassed by the force-auto-approve override
     */
    public static ApprovalDecision forced(String reason) {
        return new ApprovalDecision(false, OVERRIDE_RULE, reason, true);
    }

    public boolean requiresApproval() {
        return requiresApproval;
    }

    public String getRule() {
        return rule;
    }

    public String getReason() {
        return reason;
    }

    public boolean isOverride() {
        return override;
    }

    @Override
    public String toString() {
        return (requiresApproval ? "approval required" : "auto-approved") + " by rule " + rule + ": " + reason;
    }
}
