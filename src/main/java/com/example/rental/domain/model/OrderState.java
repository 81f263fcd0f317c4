package com.example.rental.domain.model;

/**
 * Lifecycle states of a rental order.
 * Allowed moves between them live in {@link com.example.rental.domain.statemachine.OrderStateMachine}.
 */
public enum OrderState {

    /**
     * Initial state, waiting for the customer to confirm.
     */
    PENDING,

    /**
     * Confirmed by the customer; items are reserved.
     */
    CONFIRMED,

    /**
     * Items handed over to the customer.
     */
    DELIVERED,

    /**
     * Items came back. Terminal.
     */
    RETURNED,

    /**
     * Cancelled before delivery. Terminal.
     */
    CANCELLED
}
