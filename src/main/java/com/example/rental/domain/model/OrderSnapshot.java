package com.example.rental.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The fields of an order that a lifecycle transition may change.
 * Captured before a transition so it can be restored by undo.
 */
public record OrderSnapshot(OrderState state, Instant returnDate) {

    public OrderSnapshot {
        Objects.requireNonNull(state, "State cannot be null");
    }
}
