package com.enterprise.taskrouting.retry;

/**
 * Decides whether a failed attempt is worth retrying.
 * Registered per external collaborator on the {@link RetryExecutor}.
 */
public interface FailureClassifier {

    FailureClass classify(String actionName, InvocationResponse response);

    FailureClass classify(String actionName, Throwable error);
}
