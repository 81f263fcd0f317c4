package com.example.rental.application.port.out;

/**
 * Outbound port issuing gap-free, strictly increasing numbers per named counter.
 * Uniqueness holds across every thread and process sharing the backing store.
 */
public interface SequenceGenerator {

    /**
     * Returns the next value of the counter, creating it at 0 first if it does not exist.
     *
     * @param counterName non-blank, at most 50 characters
     * @return a value strictly greater than any value returned before for this name
     * @throws com.example.rental.application.exception.SequenceGenerationFailedException
     *         if the store aborted the increment; nothing was committed and the call may be retried
     */
    long next(String counterName);

    /**
     * Last value issued for the counter, or 0 when it has never been used. Takes no lock.
     */
    long peek(String counterName);

    /**
     * Administrative overwrite of the counter value. Creates the counter if needed.
     *
     * @param value must be &gt;= 0
     */
    void reset(String counterName, long value);
}
