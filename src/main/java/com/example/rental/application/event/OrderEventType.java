package com.example.rental.application.event;

/**
 * Lifecycle events published after each successful transition.
 */
public enum OrderEventType {

    ORDER_CREATED,
    ORDER_CONFIRMED,
    ORDER_DELIVERED,
    ORDER_RETURNED,
    ORDER_CANCELLED,

    /**
     * Published in addition to {@link #ORDER_RETURNED} when the return came after the grace period.
     */
    LATE_RETURN
}
