package com.example.rental.unit.observer;

import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderEventType;
import com.example.rental.infrastructure.observer.AuditLogObserver;
import com.example.rental.infrastructure.persistence.entity.AuditLogEntity;
import com.example.rental.infrastructure.persistence.repository.AuditLogRepository;
import com.example.rental.support.TestOrders;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuditLogObserver Tests")
class AuditLogObserverTest {

    @Mock
    private AuditLogRepository repository;

    private AuditLogObserver observer;
    private final RentalOrderResult order = RentalOrderResult.from(TestOrders.pending(LocalDate.of(2024, 6, 10)));

    @BeforeEach
    void setUp() {
        observer = new AuditLogObserver(repository, new ObjectMapper());
    }

    @Test
    @DisplayName("should_keep_entry_and_persist_metadata_as_json")
    void should_keep_entry_and_persist_metadata_as_json() {
        // Given
        Instant at = Instant.parse("2024-06-08T10:00:00Z");
        OrderEvent event = new OrderEvent(OrderEventType.ORDER_CONFIRMED, order, at,
                Map.of("previousState", "PENDING"));

        // When
        observer.update(event);

        // Then
        assertThat(observer.getEntries()).hasSize(1);
        AuditLogObserver.AuditEntry entry = observer.getEntries().get(0);
        assertThat(entry.id()).startsWith("AUDIT-");
        assertThat(entry.eventType()).isEqualTo("ORDER_CONFIRMED");
        assertThat(observer.getEntriesForOrder(order.orderId())).containsExactly(entry);

        ArgumentCaptor<AuditLogEntity> saved = ArgumentCaptor.forClass(AuditLogEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(entry.id());
        assertThat(saved.getValue().getOccurredAt()).isEqualTo(at);
        assertThat(saved.getValue().getCustomerId()).isEqualTo("CUST-1");
        assertThat(saved.getValue().getMetadata()).isEqualTo("{\"previousState\":\"PENDING\"}");
    }

    @Test
    @DisplayName("should_clear_in_memory_entries")
    void should_clear_in_memory_entries() {
        observer.update(new OrderEvent(OrderEventType.ORDER_CREATED, order, Instant.now(), Map.of()));

        observer.clear();

        assertThat(observer.getEntries()).isEmpty();
    }
}
