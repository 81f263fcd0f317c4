package com.example.rental.application.exception;

public class UndoNotAvailableException extends CommandHistoryException {

    public UndoNotAvailableException() {
        super("No command to undo");
    }
}
