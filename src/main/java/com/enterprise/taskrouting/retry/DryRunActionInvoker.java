package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.core.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the action instead of performing it and reports success
 */
public class DryRunActionInvoker implements ActionInvoker {

    private static final Logger logger = LoggerFactory.getLogger(DryRunActionInvoker.class);

    @Override
    public InvocationResponse invoke(String actionName, Payload payload) {
        logger.info("[dry-run] {} with fields {}", actionName, payload.getFields().keySet());
        return InvocationResponse.success("dry-run " + actionName);
    }
}
