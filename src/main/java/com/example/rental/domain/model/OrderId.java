package com.example.rental.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Value Object identifying a rental order.
 * Distinct from the human-facing order number, which comes from the sequence generator.
 */
public final class OrderId {

    private final String value;

    private OrderId(String value) {
        this.value = value;
    }

    /**
     * Parses an order identifier.
     *
     * @param value UUID string
     * @return the identifier
     * @throws IllegalArgumentException if value is not a UUID
     */
    public static OrderId of(String value) {
        Objects.requireNonNull(value, "OrderId value cannot be null");
        try {
            return new OrderId(UUID.fromString(value).toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid OrderId format: " + value, e);
        }
    }

    public static OrderId generate() {
        return new OrderId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderId other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
