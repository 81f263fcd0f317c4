package com.example.rental.application.exception;

/**
 * Base class for undo/redo failures.
 */
public abstract class CommandHistoryException extends RuntimeException {

    protected CommandHistoryException(String message) {
        super(message);
    }

    protected CommandHistoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
