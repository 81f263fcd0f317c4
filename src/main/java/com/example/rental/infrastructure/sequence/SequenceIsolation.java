package com.example.rental.infrastructure.sequence;

import org.springframework.transaction.TransactionDefinition;

/**
 * Isolation levels accepted by {@code rental.sequence.isolation}.
 * The row lock gives correctness at either level; SERIALIZABLE may raise more aborts under contention.
 */
public enum SequenceIsolation {

    READ_COMMITTED(TransactionDefinition.ISOLATION_READ_COMMITTED),
    REPEATABLE_READ(TransactionDefinition.ISOLATION_REPEATABLE_READ),
    SERIALIZABLE(TransactionDefinition.ISOLATION_SERIALIZABLE);

    private final int level;

    SequenceIsolation(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
