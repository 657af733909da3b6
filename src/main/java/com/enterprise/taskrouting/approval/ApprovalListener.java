package com.enterprise.taskrouting.approval;

import com.enterprise.taskrouting.core.Task;

/**
 * Receives tasks whose approval was granted so they can be resumed
 */
@FunctionalInterface
public interface ApprovalListener {

    void onApproved(Task task);
}
