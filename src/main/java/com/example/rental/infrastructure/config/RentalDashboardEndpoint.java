package com.example.rental.infrastructure.config;

import com.example.rental.application.event.OrderEventBus;
import com.example.rental.application.event.OrderObserver;
import com.example.rental.infrastructure.observer.DashboardObserver;
import com.example.rental.infrastructure.observer.DashboardObserver.DashboardSnapshot;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator endpoint exposing the live dashboard counters and event bus health.
 */
@Component
@Endpoint(id = "rentaldashboard")
public class RentalDashboardEndpoint {

    private final DashboardObserver dashboard;
    private final OrderEventBus eventBus;

    public RentalDashboardEndpoint(DashboardObserver dashboard, OrderEventBus eventBus) {
        this.dashboard = dashboard;
        this.eventBus = eventBus;
    }

    @ReadOperation
    public Map<String, Object> dashboard() {
        DashboardSnapshot snapshot = dashboard.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalOrders", snapshot.totalOrders());
        body.put("ordersByState", snapshot.ordersByState());
        body.put("eventCounts", snapshot.eventCounts());
        body.put("lastUpdated", snapshot.lastUpdated());
        body.put("observers", eventBus.getObservers().stream().map(OrderObserver::name).toList());
        body.put("inFlightDispatches", eventBus.getInFlightCount());
        body.put("failedDispatches", eventBus.getFailureCount());
        return body;
    }
}
