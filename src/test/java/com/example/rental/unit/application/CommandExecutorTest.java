package com.example.rental.unit.application;

import com.example.rental.application.command.CommandExecutor;
import com.example.rental.application.command.CommandHistory;
import com.example.rental.application.command.CommandRecord;
import com.example.rental.application.command.TransitionCommandFactory;
import com.example.rental.domain.exception.TransitionNotAllowedException;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.OrderState;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.TransitionAction;
import com.example.rental.support.InMemoryRentalItemPort;
import com.example.rental.support.InMemoryRentalOrderPort;
import com.example.rental.support.MutableClock;
import com.example.rental.support.TestOrders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CommandExecutor Tests")
class CommandExecutorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private InMemoryRentalOrderPort orderPort;
    private TransitionCommandFactory factory;
    private CommandExecutor executor;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt(TODAY);
        orderPort = new InMemoryRentalOrderPort();
        factory = new TransitionCommandFactory(orderPort, new InMemoryRentalItemPort(), new OrderStateMachine(clock));
        executor = new CommandExecutor(new CommandHistory(CommandHistory.DEFAULT_CAPACITY, clock));
    }

    @Test
    @DisplayName("should_execute_all_in_order_and_record_each")
    void should_execute_all_in_order_and_record_each() {
        // Given
        OrderId orderId = orderPort.save(TestOrders.pending(TODAY.plusDays(2))).getOrderId();

        // When
        List<RentalOrder> results = executor.executeAll(List.of(
                factory.create(TransitionAction.CONFIRM, orderId),
                factory.create(TransitionAction.DELIVER, orderId)));

        // Then
        assertThat(results).extracting(RentalOrder::getState)
                .containsExactly(OrderState.CONFIRMED, OrderState.DELIVERED);
        assertThat(executor.getHistory()).extracting(CommandRecord::commandName)
                .containsExactly("ConfirmOrder", "DeliverOrder");
        assertThat(executor.getHistorySize()).isEqualTo(2);
    }

    @Test
    @DisplayName("should_stop_at_first_failure_without_recording_it")
    void should_stop_at_first_failure_without_recording_it() {
        // Given: delivering a pending order is rejected
        OrderId orderId = orderPort.save(TestOrders.pending(TODAY.plusDays(2))).getOrderId();

        // When & Then
        assertThatThrownBy(() -> executor.executeAll(List.of(
                factory.create(TransitionAction.DELIVER, orderId),
                factory.create(TransitionAction.CONFIRM, orderId))))
                .isInstanceOf(TransitionNotAllowedException.class);
        assertThat(executor.canUndo()).isFalse();
        assertThat(orderPort.findById(orderId).orElseThrow().getState()).isEqualTo(OrderState.PENDING);
    }

    @Test
    @DisplayName("should_move_records_between_history_and_redo_stack")
    void should_move_records_between_history_and_redo_stack() {
        OrderId orderId = orderPort.save(TestOrders.pending(TODAY.plusDays(2))).getOrderId();
        executor.execute(factory.cancel(orderId, "duplicate booking"));

        executor.undo();
        assertThat(executor.getRedoStack()).hasSize(1);
        assertThat(executor.canRedo()).isTrue();

        executor.redo();
        assertThat(executor.getRedoStack()).isEmpty();
        assertThat(orderPort.findById(orderId).orElseThrow().getState()).isEqualTo(OrderState.CANCELLED);

        executor.clearHistory();
        assertThat(executor.canUndo()).isFalse();
    }
}
