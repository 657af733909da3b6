package com.enterprise.taskrouting.exception;

/**
 * Unchecked wrapper for storage I/O failures in the task store or audit log
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
