package com.example.rental.application.exception;

/**
 * Exception thrown when a sequence increment was aborted by the store
 * (deadlock, lock timeout, lost connection). The counter is unchanged, so retrying is safe.
 */
public class SequenceGenerationFailedException extends RuntimeException {

    private final String counterName;

    public SequenceGenerationFailedException(String counterName, Throwable cause) {
        super("Failed to generate next value for counter '" + counterName + "': " + cause.getMessage(), cause);
        this.counterName = counterName;
    }

    public String getCounterName() {
        return counterName;
    }
}
