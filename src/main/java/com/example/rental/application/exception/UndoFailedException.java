package com.example.rental.application.exception;

/**
 * The command's own undo failed. It stays on the history stack.
 */
public class UndoFailedException extends CommandHistoryException {

    private final String commandName;

    public UndoFailedException(String commandName, Throwable cause) {
        super("Undo of " + commandName + " failed: " + cause.getMessage(), cause);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }
}
