package com.example.rental.infrastructure.observer;

import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderEventType;
import com.example.rental.application.event.OrderObserver;
import com.example.rental.domain.model.OrderState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live counters: events seen per type and orders currently in each state.
 * <p>
 * State buckets move using the {@code previousState} and {@code newState} metadata that
 * every transition event carries, so a cancellation always leaves the bucket it really came from.
 */
@Component
public class DashboardObserver implements OrderObserver {

    private static final Logger log = LoggerFactory.getLogger(DashboardObserver.class);

    private final Map<OrderEventType, AtomicLong> eventCounts = new EnumMap<>(OrderEventType.class);
    private final Map<OrderState, AtomicLong> stateBuckets = new EnumMap<>(OrderState.class);
    private final Map<OrderEventType, Counter> eventCounters = new EnumMap<>(OrderEventType.class);
    private final AtomicReference<Instant> lastUpdated = new AtomicReference<>();

    public DashboardObserver(MeterRegistry meterRegistry) {
        for (OrderEventType type : OrderEventType.values()) {
            eventCounts.put(type, new AtomicLong());
            eventCounters.put(type, Counter.builder("rental.orders.events")
                    .description("Lifecycle events seen by the dashboard")
                    .tag("type", type.name())
                    .register(meterRegistry));
        }
        for (OrderState state : OrderState.values()) {
            AtomicLong bucket = new AtomicLong();
            stateBuckets.put(state, bucket);
            Gauge.builder("rental.orders.by_state", bucket, AtomicLong::get)
                    .description("Orders currently in each lifecycle state")
                    .tag("state", state.name())
                    .register(meterRegistry);
        }
    }

    @Override
    public String name() {
        return "Dashboard";
    }

    @Override
    public void update(OrderEvent event) {
        eventCounts.get(event.type()).incrementAndGet();
        eventCounters.get(event.type()).increment();
        lastUpdated.set(event.timestamp());

        if (event.type() == OrderEventType.LATE_RETURN) {
            return;
        }
        String previous = event.metadataString("previousState");
        String next = event.metadataString("newState");
        if (previous != null) {
            decrement(OrderState.valueOf(previous));
        }
        if (next != null) {
            stateBuckets.get(OrderState.valueOf(next)).incrementAndGet();
        } else {
            log.warn("Dashboard ignored {} for order {}: no newState metadata", event.type(), event.orderId());
        }
    }

    private void decrement(OrderState state) {
        stateBuckets.get(state).updateAndGet(value -> Math.max(0, value - 1));
    }

    public long getEventCount(OrderEventType type) {
        return eventCounts.get(type).get();
    }

    public long getStateCount(OrderState state) {
        return stateBuckets.get(state).get();
    }

    public DashboardSnapshot snapshot() {
        Map<OrderEventType, Long> events = new EnumMap<>(OrderEventType.class);
        eventCounts.forEach((type, count) -> events.put(type, count.get()));
        Map<OrderState, Long> states = new EnumMap<>(OrderState.class);
        stateBuckets.forEach((state, count) -> states.put(state, count.get()));
        return new DashboardSnapshot(events, states, events.get(OrderEventType.ORDER_CREATED), lastUpdated.get());
    }

    public void reset() {
        eventCounts.values().forEach(count -> count.set(0));
        stateBuckets.values().forEach(count -> count.set(0));
        lastUpdated.set(null);
    }

    public record DashboardSnapshot(
            Map<OrderEventType, Long> eventCounts,
            Map<OrderState, Long> ordersByState,
            long totalOrders,
            Instant lastUpdated
    ) {
    }
}
