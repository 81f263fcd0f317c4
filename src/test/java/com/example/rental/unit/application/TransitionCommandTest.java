package com.example.rental.unit.application;

import com.example.rental.application.command.*;
import com.example.rental.domain.exception.OrderNotFoundException;
import com.example.rental.domain.exception.TransitionNotAllowedException;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.OrderSnapshot;
import com.example.rental.domain.model.OrderState;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.support.InMemoryRentalItemPort;
import com.example.rental.support.InMemoryRentalOrderPort;
import com.example.rental.support.MutableClock;
import com.example.rental.support.TestOrders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the four lifecycle commands against in-memory ports.
 */
@DisplayName("Transition Command Tests")
class TransitionCommandTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private MutableClock clock;
    private InMemoryRentalOrderPort orderPort;
    private InMemoryRentalItemPort itemPort;
    private TransitionCommandFactory factory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(TODAY);
        orderPort = new InMemoryRentalOrderPort();
        itemPort = new InMemoryRentalItemPort();
        factory = new TransitionCommandFactory(orderPort, itemPort, new OrderStateMachine(clock));
    }

    private RentalOrder stored(OrderState state, LocalDate rentalDate, String... items) {
        return orderPort.save(TestOrders.inState(state, rentalDate, null, items));
    }

    private OrderState stateOf(OrderId orderId) {
        return orderPort.findById(orderId).orElseThrow().getState();
    }

    @Nested
    @DisplayName("Execute then undo")
    class RoundTrip {

        @Test
        @DisplayName("should_restore_pending_after_confirm_undo")
        void should_restore_pending_after_confirm_undo() {
            // Given
            RentalOrder order = stored(OrderState.PENDING, TODAY.plusDays(3));
            OrderSnapshot before = order.snapshot();
            ConfirmOrderCommand command = factory.confirm(order.getOrderId());

            // When
            RentalOrder confirmed = command.execute();
            command.undo();

            // Then
            assertThat(confirmed.getState()).isEqualTo(OrderState.CONFIRMED);
            assertThat(orderPort.findById(order.getOrderId()).orElseThrow().snapshot()).isEqualTo(before);
        }

        @Test
        @DisplayName("should_clear_return_date_after_return_undo")
        void should_clear_return_date_after_return_undo() {
            // Given
            RentalOrder order = stored(OrderState.DELIVERED, TODAY.minusDays(1));
            ReturnOrderCommand command = factory.returnOrder(order.getOrderId());

            // When
            RentalOrder returned = command.execute();

            // Then
            assertThat(returned.getReturnDate()).isEqualTo(clock.instant());
            assertThat(command.params()).containsEntry("previousState", "DELIVERED").containsKey("returnDate");

            // When
            command.undo();

            // Then
            RentalOrder reverted = orderPort.findById(order.getOrderId()).orElseThrow();
            assertThat(reverted.getState()).isEqualTo(OrderState.DELIVERED);
            assertThat(reverted.getReturnDate()).isNull();
        }

        @Test
        @DisplayName("should_release_items_on_cancel_and_restore_flags_on_undo")
        void should_release_items_on_cancel_and_restore_flags_on_undo() {
            // Given: items rented out by this order, one already flagged available elsewhere
            itemPort.with("DRESS-1", false).with("SHOES-2", true);
            RentalOrder order = stored(OrderState.CONFIRMED, TODAY.plusDays(5), "DRESS-1", "SHOES-2");
            CancelOrderCommand command = factory.cancel(order.getOrderId(), "customer changed plans");

            // When
            command.execute();

            // Then
            assertThat(stateOf(order.getOrderId())).isEqualTo(OrderState.CANCELLED);
            assertThat(itemPort.isAvailable("DRESS-1")).isTrue();
            assertThat(itemPort.isAvailable("SHOES-2")).isTrue();
            assertThat(command.releasedItems()).hasSize(2);
            assertThat(command.params()).containsEntry("reason", "customer changed plans");

            // When
            command.undo();

            // Then
            assertThat(stateOf(order.getOrderId())).isEqualTo(OrderState.CONFIRMED);
            assertThat(itemPort.isAvailable("DRESS-1")).isFalse();
            assertThat(itemPort.isAvailable("SHOES-2")).isTrue();
        }

        @Test
        @DisplayName("should_redo_by_executing_again")
        void should_redo_by_executing_again() {
            RentalOrder order = stored(OrderState.CONFIRMED, TODAY.plusDays(2));
            DeliverOrderCommand command = factory.deliver(order.getOrderId());

            command.execute();
            command.undo();
            command.execute();

            assertThat(stateOf(order.getOrderId())).isEqualTo(OrderState.DELIVERED);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should_refuse_undo_before_execute")
        void should_refuse_undo_before_execute() {
            RentalOrder order = stored(OrderState.PENDING, TODAY);
            ConfirmOrderCommand command = factory.confirm(order.getOrderId());

            assertThatThrownBy(command::undo)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("not executed");
        }

        @Test
        @DisplayName("should_raise_not_found_for_unknown_order")
        void should_raise_not_found_for_unknown_order() {
            ConfirmOrderCommand command = factory.confirm(OrderId.generate());

            assertThatThrownBy(command::execute).isInstanceOf(OrderNotFoundException.class);
        }

        @Test
        @DisplayName("should_leave_order_untouched_when_transition_rejected")
        void should_leave_order_untouched_when_transition_rejected() {
            // Given
            RentalOrder order = stored(OrderState.PENDING, TODAY);
            int savesBefore = orderPort.getSaveCount();

            // When / Then
            assertThatThrownBy(() -> factory.deliver(order.getOrderId()).execute())
                    .isInstanceOf(TransitionNotAllowedException.class);
            assertThat(orderPort.getSaveCount()).isEqualTo(savesBefore);
            assertThat(stateOf(order.getOrderId())).isEqualTo(OrderState.PENDING);
        }

        @Test
        @DisplayName("should_refuse_undo_when_order_moved_on")
        void should_refuse_undo_when_order_moved_on() {
            // Given: confirmed, then delivered by a later command
            RentalOrder order = stored(OrderState.PENDING, TODAY.plusDays(1));
            ConfirmOrderCommand confirm = factory.confirm(order.getOrderId());
            confirm.execute();
            factory.deliver(order.getOrderId()).execute();

            // When / Then: PENDING -> DELIVERED is not an edge
            assertThatThrownBy(confirm::undo).isInstanceOf(TransitionNotAllowedException.class);
            assertThat(stateOf(order.getOrderId())).isEqualTo(OrderState.DELIVERED);
        }
    }
}
