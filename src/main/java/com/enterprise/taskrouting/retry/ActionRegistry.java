package com.enterprise.taskrouting.retry;

import com.enterprise.taskrouting.core.Payload;
import com.enterprise.taskrouting.exception.ActionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes each action to the invoker registered for it. An invoker registered as
 * {@code post} also serves the steps {@code post.<step>} unless a step has its own.
 * Actions with no invoker go to the fallback, or fail permanently without one.
 */
public class ActionRegistry implements ActionInvoker {

    private static final Logger logger = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, ActionInvoker> invokers = new ConcurrentHashMap<>();
    private volatile ActionInvoker fallback;

    public void register(String actionName, ActionInvoker invoker) {
        invokers.put(actionName, invoker);
        logger.info("Registered invoker for action: {}", actionName);
    }

    public void unregister(String actionName) {
        ActionInvoker removed = invokers.remove(actionName);
        if (removed != null) {
            logger.info("Unregistered invoker for action: {}", actionName);
        }
    }

    public void setFallback(ActionInvoker fallback) {
        this.fallback = fallback;
    }

    public Set<String> getRegisteredActions() {
        return Set.copyOf(invokers.keySet());
    }

    @Override
    public InvocationResponse invoke(String actionName, Payload payload) throws Exception {
        ActionInvoker invoker = resolve(actionName).orElseThrow(() -> new ActionNotFoundException(actionName));
        return invoker.invoke(actionName, payload);
    }

    Optional<ActionInvoker> resolve(String actionName) {
        ActionInvoker exact = invokers.get(actionName);
        if (exact != null) {
            return Optional.of(exact);
        }
        int separator = actionName.indexOf('.');
        if (separator > 0) {
            ActionInvoker parent = invokers.get(actionName.substring(0, separator));
            if (parent != null) {
                return Optional.of(parent);
            }
        }
        return Optional.ofNullable(fallback);
    }
}
