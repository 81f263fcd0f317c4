package com.example.rental.application.event;

import com.example.rental.application.dto.RentalOrderResult;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable lifecycle event handed to every matching observer.
 *
 * @param type      event type
 * @param order     view of the order at publication time
 * @param timestamp when the event was published
 * @param metadata  event details (previousState, newState, ...), never null
 */
public record OrderEvent(
        OrderEventType type,
        RentalOrderResult order,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public OrderEvent {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(order, "Order cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String orderId() {
        return order.orderId();
    }

    /**
     * Metadata value as a string, or null when absent.
     */
    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }
}
