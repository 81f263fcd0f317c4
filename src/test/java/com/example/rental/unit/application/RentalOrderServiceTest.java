package com.example.rental.unit.application;

import com.example.rental.application.command.CommandExecutor;
import com.example.rental.application.command.CommandHistory;
import com.example.rental.application.command.TransitionCommandFactory;
import com.example.rental.application.dto.CreateRentalOrderCommand;
import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderEventBus;
import com.example.rental.application.event.OrderEventType;
import com.example.rental.application.exception.RedoFailedException;
import com.example.rental.application.exception.UndoFailedException;
import com.example.rental.application.port.out.SequenceGenerator;
import com.example.rental.application.service.RentalOrderService;
import com.example.rental.domain.exception.InvalidRentalDateException;
import com.example.rental.domain.exception.ItemUnavailableException;
import com.example.rental.domain.exception.OrderNotDeletableException;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.support.InMemoryRentalItemPort;
import com.example.rental.support.InMemoryRentalOrderPort;
import com.example.rental.support.MutableClock;
import com.example.rental.support.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RentalOrderService with in-memory ports and a synchronous event bus.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RentalOrderService Tests")
class RentalOrderServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Mock
    private SequenceGenerator sequenceGenerator;

    @Mock
    private PlatformTransactionManager transactionManager;

    private MutableClock clock;
    private InMemoryRentalOrderPort orderPort;
    private InMemoryRentalItemPort itemPort;
    private RecordingObserver observer;
    private RentalOrderService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(TODAY);
        orderPort = new InMemoryRentalOrderPort();
        itemPort = new InMemoryRentalItemPort().with("SUIT-1", true).with("TIE-2", true).with("HAT-3", false);
        observer = new RecordingObserver("recorder");

        OrderStateMachine stateMachine = new OrderStateMachine(clock);
        OrderEventBus eventBus = new OrderEventBus(Runnable::run, 1000, clock);
        eventBus.attach(observer);

        service = new RentalOrderService(orderPort, itemPort, sequenceGenerator, stateMachine,
                new CommandExecutor(new CommandHistory(50, clock)),
                new TransitionCommandFactory(orderPort, itemPort, stateMachine),
                eventBus, new TransactionTemplate(transactionManager), clock);
    }

    private RentalOrderResult createOrder(LocalDate rentalDate, String... items) {
        return service.createOrder(new CreateRentalOrderCommand("CUST-1", "STAFF-1", rentalDate,
                List.of(items), new BigDecimal("180000")));
    }

    @Nested
    @DisplayName("Create")
    class Create {

        @Test
        @DisplayName("should_create_pending_order_with_next_number_and_rent_items")
        void should_create_pending_order_with_next_number_and_rent_items() {
            // Given
            when(sequenceGenerator.next(anyString())).thenReturn(42L);

            // When
            RentalOrderResult result = createOrder(TODAY.plusDays(4), "SUIT-1", "TIE-2");

            // Then
            assertThat(result.number()).isEqualTo(42L);
            assertThat(result.state()).isEqualTo("PENDING");
            assertThat(itemPort.isAvailable("SUIT-1")).isFalse();
            assertThat(itemPort.isAvailable("TIE-2")).isFalse();
            assertThat(observer.types()).containsExactly(OrderEventType.ORDER_CREATED);
            verify(sequenceGenerator).next("rental-order");
        }

        @Test
        @DisplayName("should_reject_rental_date_in_the_past_without_taking_a_number")
        void should_reject_rental_date_in_the_past_without_taking_a_number() {
            assertThatThrownBy(() -> createOrder(TODAY.minusDays(1), "SUIT-1"))
                    .isInstanceOf(InvalidRentalDateException.class);
            verifyNoInteractions(sequenceGenerator);
        }

        @Test
        @DisplayName("should_reject_unavailable_or_unknown_items")
        void should_reject_unavailable_or_unknown_items() {
            assertThatThrownBy(() -> createOrder(TODAY, "SUIT-1", "HAT-3", "GHOST-9"))
                    .isInstanceOf(ItemUnavailableException.class)
                    .hasMessageContaining("HAT-3")
                    .hasMessageContaining("GHOST-9");
            verifyNoInteractions(sequenceGenerator);
            assertThat(itemPort.isAvailable("SUIT-1")).isTrue();
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("should_publish_returned_and_late_return_for_late_return")
        void should_publish_returned_and_late_return_for_late_return() {
            // Given
            when(sequenceGenerator.next(anyString())).thenReturn(1L);
            OrderId orderId = OrderId.of(createOrder(TODAY.plusDays(2), "SUIT-1").orderId());
            service.confirm(orderId);
            service.deliver(orderId);

            // When: returned six days after the rental date
            clock.setDay(TODAY.plusDays(8));
            RentalOrderResult returned = service.returnOrder(orderId);

            // Then
            assertThat(returned.state()).isEqualTo("RETURNED");
            assertThat(observer.types()).containsExactly(
                    OrderEventType.ORDER_CREATED,
                    OrderEventType.ORDER_CONFIRMED,
                    OrderEventType.ORDER_DELIVERED,
                    OrderEventType.ORDER_RETURNED,
                    OrderEventType.LATE_RETURN);
            OrderEvent late = observer.events().get(4);
            assertThat(late.metadata())
                    .containsEntry("previousState", "DELIVERED")
                    .containsEntry("elapsedDays", 6L)
                    .containsEntry("lateReturn", true)
                    .containsEntry("daysLate", 3L);
        }

        @Test
        @DisplayName("should_carry_prior_state_reason_and_released_items_on_cancel")
        void should_carry_prior_state_reason_and_released_items_on_cancel() {
            // Given
            when(sequenceGenerator.next(anyString())).thenReturn(5L);
            OrderId orderId = OrderId.of(createOrder(TODAY.plusDays(1), "SUIT-1").orderId());
            service.confirm(orderId);

            // When
            service.cancel(orderId, "wedding postponed");

            // Then
            OrderEvent cancelled = observer.events().get(2);
            assertThat(cancelled.type()).isEqualTo(OrderEventType.ORDER_CANCELLED);
            assertThat(cancelled.metadata())
                    .containsEntry("previousState", "CONFIRMED")
                    .containsEntry("newState", "CANCELLED")
                    .containsEntry("reason", "wedding postponed")
                    .containsEntry("releasedItems", List.of("SUIT-1"))
                    .containsEntry("lateCancellation", true);
            assertThat(itemPort.isAvailable("SUIT-1")).isTrue();
        }

        @Test
        @DisplayName("should_undo_and_redo_last_transition")
        void should_undo_and_redo_last_transition() {
            // Given
            when(sequenceGenerator.next(anyString())).thenReturn(9L);
            OrderId orderId = OrderId.of(createOrder(TODAY.plusDays(3), "SUIT-1").orderId());
            service.confirm(orderId);

            // When
            service.undo();

            // Then
            assertThat(service.getOrder(orderId).state()).isEqualTo("PENDING");
            assertThat(service.canRedo()).isTrue();

            // When
            service.redo();

            // Then
            assertThat(service.getOrder(orderId).state()).isEqualTo("CONFIRMED");
            assertThat(service.getHistory()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Commit Failure")
    class CommitFailure {

        private final TransactionSystemException commitFailed = new TransactionSystemException("commit failed");

        @Test
        @DisplayName("should_not_record_or_publish_transition_whose_commit_failed")
        void should_not_record_or_publish_transition_whose_commit_failed() {
            // Given: the create commits, the confirm does not
            when(sequenceGenerator.next(anyString())).thenReturn(11L);
            doNothing().doThrow(commitFailed).when(transactionManager).commit(any());
            OrderId orderId = OrderId.of(createOrder(TODAY.plusDays(3), "SUIT-1").orderId());

            // When & Then
            assertThatThrownBy(() -> service.confirm(orderId)).isSameAs(commitFailed);
            assertThat(service.canUndo()).isFalse();
            assertThat(service.getHistory()).isEmpty();
            assertThat(observer.types()).containsExactly(OrderEventType.ORDER_CREATED);
        }

        @Test
        @DisplayName("should_keep_command_on_history_when_undo_commit_fails")
        void should_keep_command_on_history_when_undo_commit_fails() {
            // Given: create and confirm commit, the undo does not
            when(sequenceGenerator.next(anyString())).thenReturn(12L);
            doNothing().doNothing().doThrow(commitFailed).when(transactionManager).commit(any());
            OrderId orderId = OrderId.of(createOrder(TODAY.plusDays(3), "SUIT-1").orderId());
            service.confirm(orderId);

            // When & Then
            assertThatThrownBy(() -> service.undo())
                    .isInstanceOf(UndoFailedException.class)
                    .hasCause(commitFailed);
            assertThat(service.canUndo()).isTrue();
            assertThat(service.canRedo()).isFalse();
            assertThat(service.getHistory()).singleElement()
                    .satisfies(record -> assertThat(record.error()).contains("commit failed"));
        }

        @Test
        @DisplayName("should_keep_command_on_redo_stack_when_redo_commit_fails")
        void should_keep_command_on_redo_stack_when_redo_commit_fails() {
            // Given: create, confirm and undo commit, the redo does not
            when(sequenceGenerator.next(anyString())).thenReturn(13L);
            doNothing().doNothing().doNothing().doThrow(commitFailed).when(transactionManager).commit(any());
            OrderId orderId = OrderId.of(createOrder(TODAY.plusDays(3), "SUIT-1").orderId());
            service.confirm(orderId);
            service.undo();

            // When & Then
            assertThatThrownBy(() -> service.redo())
                    .isInstanceOf(RedoFailedException.class)
                    .hasCause(commitFailed);
            assertThat(service.canRedo()).isTrue();
            assertThat(service.canUndo()).isFalse();
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("should_delete_pending_order_and_release_items")
        void should_delete_pending_order_and_release_items() {
            when(sequenceGenerator.next(anyString())).thenReturn(3L);
            OrderId orderId = OrderId.of(createOrder(TODAY, "TIE-2").orderId());

            service.deleteOrder(orderId);

            assertThat(orderPort.contains(orderId)).isFalse();
            assertThat(itemPort.isAvailable("TIE-2")).isTrue();
        }

        @Test
        @DisplayName("should_refuse_to_delete_confirmed_order")
        void should_refuse_to_delete_confirmed_order() {
            when(sequenceGenerator.next(anyString())).thenReturn(4L);
            OrderId orderId = OrderId.of(createOrder(TODAY, "TIE-2").orderId());
            service.confirm(orderId);

            assertThatThrownBy(() -> service.deleteOrder(orderId))
                    .isInstanceOf(OrderNotDeletableException.class)
                    .hasMessageContaining("CONFIRMED");
            assertThat(orderPort.contains(orderId)).isTrue();
        }
    }
}
