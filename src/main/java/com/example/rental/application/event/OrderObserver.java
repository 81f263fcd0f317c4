package com.example.rental.application.event;

import java.util.Set;

/**
 * Receives lifecycle events from {@link OrderEventBus}.
 * Implementations may be slow or fail; the bus isolates them from each other and from the caller.
 */
public interface OrderObserver {

    /**
     * Unique name; the bus attaches at most one observer per name.
     */
    String name();

    /**
     * Event types this observer wants. Empty means all.
     */
    default Set<OrderEventType> subscribedEvents() {
        return Set.of();
    }

    default boolean isSubscribed(OrderEventType type) {
        Set<OrderEventType> subscribed = subscribedEvents();
        return subscribed.isEmpty() || subscribed.contains(type);
    }

    void update(OrderEvent event);
}
