package com.example.rental.infrastructure.persistence.entity;

/**
 * Order state as stored in the {@code rental_orders.state} column.
 */
public enum OrderStateEnum {
    PENDING,
    CONFIRMED,
    DELIVERED,
    RETURNED,
    CANCELLED
}
