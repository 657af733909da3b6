package com.enterprise.taskrouting.retry;

/**
 * Classification of a failed action attempt
 */
public enum FailureClass {
    /** Network, timeout or rate-limit class; worth retrying after a backoff */
    TRANSIENT,
    /** Authentication, permission or not-found class; retrying cannot help */
    PERMANENT
}
