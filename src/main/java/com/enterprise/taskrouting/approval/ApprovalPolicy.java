package com.enterprise.taskrouting.approval;

import java.util.List;

/**
 * Ordered list of approval rules; the first matching rule decides
 */
public final class ApprovalPolicy {

    private final List<ApprovalRule> rules;

    public ApprovalPolicy(List<ApprovalRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Built-in policy: sensitive content, large batches, first actions and new
     * contacts need a human; low-priority updates and known personal contacts
     * run unattended; anything else needs a human.
     */
    public static ApprovalPolicy defaultPolicy(List<String> sensitiveKeywords, int maxBatchSize) {
        return new ApprovalPolicy(List.of(
            ApprovalRule.sensitiveKeyword(sensitiveKeywords),
            ApprovalRule.batchSizeOver(maxBatchSize),
            ApprovalRule.firstActionOnPlatform(),
            ApprovalRule.newContact(),
            ApprovalRule.lowPriorityUpdate(),
            ApprovalRule.knownPersonalContact()));
    }

    public List<ApprovalRule> getRules() {
        return rules;
    }
}
