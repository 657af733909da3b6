package com.enterprise.taskrouting.exception;

/**
 * Exception thrown when no invoker is registered for an action
 */
public class ActionNotFoundException extends TaskRoutingException {

    private final String actionName;

    public ActionNotFoundException(String actionName) {
        super("No invoker registered for action: " + actionName);
        this.actionName = actionName;
    }

    public String getActionName() {
        return actionName;
    }
}
