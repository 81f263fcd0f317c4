package com.example.rental.infrastructure.observer;

import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderEventType;
import com.example.rental.application.event.OrderObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Produces a plain-text report when an order closes or comes back late.
 */
@Component
public class ReportGeneratorObserver implements OrderObserver {

    private static final Logger log = LoggerFactory.getLogger(ReportGeneratorObserver.class);

    private static final Set<OrderEventType> EVENTS = EnumSet.of(
            OrderEventType.ORDER_RETURNED,
            OrderEventType.ORDER_CANCELLED,
            OrderEventType.LATE_RETURN);

    private final List<Report> reports = new CopyOnWriteArrayList<>();

    @Override
    public String name() {
        return "ReportGenerator";
    }

    @Override
    public Set<OrderEventType> subscribedEvents() {
        return EVENTS;
    }

    @Override
    public void update(OrderEvent event) {
        Report report = new Report("RPT-" + UUID.randomUUID(), event.type(), event.orderId(),
                event.timestamp(), content(event));
        reports.add(report);
        log.info("Report {} generated for {} order={}", report.id(), event.type(), event.orderId());
    }

    private String content(OrderEvent event) {
        RentalOrderResult order = event.order();
        StringBuilder text = new StringBuilder()
                .append("Order #").append(order.number()).append(" (").append(order.orderId()).append(")\n")
                .append("Customer: ").append(order.customerId()).append('\n')
                .append("Staff: ").append(order.staffId()).append('\n')
                .append("Rental date: ").append(order.rentalDate()).append('\n')
                .append("Total: ").append(order.total()).append(' ').append(order.currency()).append('\n');
        switch (event.type()) {
            case ORDER_RETURNED -> text.append("RETURN REPORT\n")
                    .append("Returned at: ").append(order.returnDate()).append('\n')
                    .append("Days out: ").append(event.metadataString("elapsedDays")).append('\n')
                    .append("Late: ").append(event.metadataString("lateReturn"));
            case ORDER_CANCELLED -> text.append("CANCELLATION REPORT\n")
                    .append("Cancelled from: ").append(event.metadataString("previousState")).append('\n')
                    .append("Reason: ").append(event.metadataString("reason")).append('\n')
                    .append("Released items: ").append(event.metadataString("releasedItems")).append('\n')
                    .append("Late cancellation: ").append(event.metadataString("lateCancellation"));
            case LATE_RETURN -> text.append("LATE RETURN REPORT\n")
                    .append("Days late: ").append(event.metadataString("daysLate"));
            default -> throw new IllegalArgumentException("No report for event " + event.type());
        }
        return text.toString();
    }

    public List<Report> getReports() {
        return List.copyOf(reports);
    }

    public List<Report> getReports(OrderEventType type) {
        return reports.stream().filter(report -> report.type() == type).toList();
    }

    public void clear() {
        reports.clear();
    }

    public record Report(String id, OrderEventType type, String orderId, Instant generatedAt, String content) {
    }
}
