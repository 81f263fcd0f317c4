package com.example.rental.infrastructure.observer;

import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderObserver;
import com.example.rental.infrastructure.persistence.entity.AuditLogEntity;
import com.example.rental.infrastructure.persistence.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every lifecycle event, in memory for quick inspection and in the
 * {@code audit_log} table for the durable trail.
 */
@Component
public class AuditLogObserver implements OrderObserver {

    private static final Logger log = LoggerFactory.getLogger(AuditLogObserver.class);

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;
    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditLogObserver(AuditLogRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "AuditLog";
    }

    @Override
    public void update(OrderEvent event) {
        AuditEntry entry = new AuditEntry(
                "AUDIT-" + UUID.randomUUID(),
                event.type().name(),
                event.orderId(),
                event.order().number(),
                event.order().customerId(),
                event.timestamp(),
                event.metadata());
        entries.add(entry);

        repository.save(new AuditLogEntity(entry.id(), entry.eventType(), entry.orderId(), entry.orderNumber(),
                entry.customerId(), entry.timestamp(), serializeMetadata(event.metadata())));
        log.debug("Audit entry {} recorded for {} order={}", entry.id(), entry.eventType(), entry.orderId());
    }

    public List<AuditEntry> getEntries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> getEntriesForOrder(String orderId) {
        return entries.stream().filter(entry -> entry.orderId().equals(orderId)).toList();
    }

    public void clear() {
        entries.clear();
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit metadata", e);
            return "{}";
        }
    }

    /**
     * In-memory audit entry.
     */
    public record AuditEntry(
            String id,
            String eventType,
            String orderId,
            long orderNumber,
            String customerId,
            Instant timestamp,
            Map<String, Object> metadata
    ) {
    }
}
