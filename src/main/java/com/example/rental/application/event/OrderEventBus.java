package com.example.rental.application.event;

import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.domain.model.RentalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans lifecycle events out to registered observers.
 * <p>
 * Each matching observer runs as its own task on the dispatch executor with its own timeout.
 * A failing or slow observer is logged and never affects the others or the publisher: the
 * future returned by {@link #publish(OrderEvent)} always completes normally.
 */
public class OrderEventBus {

    private static final Logger log = LoggerFactory.getLogger(OrderEventBus.class);

    private final Executor executor;
    private final long observerTimeoutMs;
    private final Clock clock;
    private final Map<String, OrderObserver> observers = new LinkedHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicLong failures = new AtomicLong(0);

    public OrderEventBus(Executor executor, long observerTimeoutMs, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        if (observerTimeoutMs <= 0) {
            throw new IllegalArgumentException("Observer timeout must be positive: " + observerTimeoutMs);
        }
        this.observerTimeoutMs = observerTimeoutMs;
    }

    /**
     * Registers an observer. A second observer with the same name is ignored.
     *
     * @return true if the observer was added
     */
    public synchronized boolean attach(OrderObserver observer) {
        Objects.requireNonNull(observer, "Observer cannot be null");
        if (observers.containsKey(observer.name())) {
            log.debug("[EVENT] Observer {} already attached", observer.name());
            return false;
        }
        observers.put(observer.name(), observer);
        log.info("[EVENT] Observer attached: {} (events: {})", observer.name(),
                observer.subscribedEvents().isEmpty() ? "ALL" : observer.subscribedEvents());
        return true;
    }

    public synchronized boolean detach(String name) {
        boolean removed = observers.remove(name) != null;
        if (removed) {
            log.info("[EVENT] Observer detached: {}", name);
        }
        return removed;
    }

    public synchronized List<OrderObserver> getObservers() {
        return List.copyOf(observers.values());
    }

    public synchronized int getObserverCount() {
        return observers.size();
    }

    public synchronized void clearObservers() {
        observers.clear();
        log.info("[EVENT] All observers detached");
    }

    /**
     * Builds the event for {@code order} and publishes it.
     */
    public CompletableFuture<Void> notify(OrderEventType type, RentalOrder order, Map<String, Object> metadata) {
        return publish(new OrderEvent(type, RentalOrderResult.from(order), clock.instant(), metadata));
    }

    /**
     * Dispatches the event to every observer subscribed to its type.
     *
     * @return a future that completes once every observer finished, failed or timed out
     */
    public CompletableFuture<Void> publish(OrderEvent event) {
        List<OrderObserver> targets = new ArrayList<>();
        for (OrderObserver observer : getObservers()) {
            if (observer.isSubscribed(event.type())) {
                targets.add(observer);
            }
        }
        log.info("[EVENT] {} order={} observers={}", event.type(), event.orderId(), targets.size());

        CompletableFuture<?>[] dispatches = targets.stream()
                .map(observer -> dispatch(observer, event))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(dispatches);
    }

    private CompletableFuture<Void> dispatch(OrderObserver observer, OrderEvent event) {
        inFlight.incrementAndGet();
        CompletableFuture<Void> task;
        try {
            task = CompletableFuture.runAsync(() -> {
                try {
                    observer.update(event);
                } finally {
                    inFlight.decrementAndGet();
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            failures.incrementAndGet();
            log.error("[EVENT] Dispatch of {} to {} rejected: {}", event.type(), observer.name(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }

        return task.orTimeout(observerTimeoutMs, TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error != null) {
                        failures.incrementAndGet();
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        if (cause instanceof TimeoutException) {
                            log.warn("[EVENT] Observer {} timed out after {}ms on {} order={}",
                                    observer.name(), observerTimeoutMs, event.type(), event.orderId());
                        } else {
                            log.error("[EVENT] Observer {} failed on {} order={}: {}",
                                    observer.name(), event.type(), event.orderId(), cause.getMessage(), cause);
                        }
                    }
                    return null;
                });
    }

    /**
     * Observer tasks submitted but not yet finished, including ones past their timeout.
     */
    public int getInFlightCount() {
        return inFlight.get();
    }

    /**
     * Observer invocations that failed, timed out or were rejected since startup.
     */
    public long getFailureCount() {
        return failures.get();
    }
}
