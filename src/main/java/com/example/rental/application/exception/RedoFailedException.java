package com.example.rental.application.exception;

/**
 * Re-execution of an undone command failed. It stays on the redo stack.
 */
public class RedoFailedException extends CommandHistoryException {

    private final String commandName;

    public RedoFailedException(String commandName, Throwable cause) {
        super("Redo of " + commandName + " failed: " + cause.getMessage(), cause);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }
}
