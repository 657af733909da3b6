package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.core.Payload;

/**
 * Executor interface to the external actors that perform actions (posting,
 * replying, sending). Called once per attempt.
 */
@FunctionalInterface
public interface ActionInvoker {

    /**
     * Invokes an action. A non-success response and a thrown exception are both
     * failed attempts; the executor classifies them as transient or permanent.
     *
     * @throws InterruptedException if the calling worker is cancelled mid-call
     */
    InvocationResponse invoke(String actionName, Payload payload) throws Exception;
}
