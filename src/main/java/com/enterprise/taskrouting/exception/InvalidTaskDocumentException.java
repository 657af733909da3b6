package com.enterprise.taskrouting.exception;

/**
 * Exception thrown when a task document cannot be parsed or is missing
 * required producer fields
 */
public class InvalidTaskDocumentException extends TaskRoutingException {

    public InvalidTaskDocumentException(String message) {
        super(message);
    }

    public InvalidTaskDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
