package com.example.rental.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Persisted audit trail entry, one per lifecycle event.
 */
@Entity
@Table(name = "audit_log", indexes = {
        @Index(name = "idx_audit_log_order", columnList = "order_id"),
        @Index(name = "idx_audit_log_event_type", columnList = "event_type")
})
public class AuditLogEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "event_type", length = 32, nullable = false)
    private String eventType;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Column(name = "order_number", nullable = false)
    private long orderNumber;

    @Column(name = "customer_id", length = 64)
    private String customerId;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "metadata", length = 4000)
    private String metadata;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected AuditLogEntity() {
    }

    public AuditLogEntity(String id, String eventType, String orderId, long orderNumber, String customerId,
                          Instant occurredAt, String metadata) {
        this.id = id;
        this.eventType = eventType;
        this.orderId = orderId;
        this.orderNumber = orderNumber;
        this.customerId = customerId;
        this.occurredAt = occurredAt;
        this.metadata = metadata;
        this.recordedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getEventType() {
        return eventType;
    }

    public String getOrderId() {
        return orderId;
    }

    public long getOrderNumber() {
        return orderNumber;
    }

    public String getCustomerId() {
        return customerId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getMetadata() {
        return metadata;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}
