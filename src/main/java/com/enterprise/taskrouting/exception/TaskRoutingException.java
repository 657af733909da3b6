package com.enterprise.taskrouting.exception;

/**
 * Base exception for task routing related errors
 */
public class TaskRoutingException extends Exception {

    public TaskRoutingException(String message) {
        super(message);
    }

    public TaskRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
