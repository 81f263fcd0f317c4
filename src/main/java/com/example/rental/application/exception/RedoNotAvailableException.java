package com.example.rental.application.exception;

public class RedoNotAvailableException extends CommandHistoryException {

    public RedoNotAvailableException() {
        super("No command to redo");
    }
}
