package com.example.rental.application.port.in;

import com.example.rental.application.command.CommandRecord;
import com.example.rental.application.dto.CreateRentalOrderCommand;
import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.statemachine.StateInfo;

import java.util.List;

/**
 * Inbound port for the rental order lifecycle.
 */
public interface RentalOrderUseCase {

    /**
     * Registers a new order in PENDING state with the next order number.
     *
     * @param command the order creation command
     * @return the created order
     */
    RentalOrderResult createOrder(CreateRentalOrderCommand command);

    RentalOrderResult confirm(OrderId orderId);

    RentalOrderResult deliver(OrderId orderId);

    RentalOrderResult returnOrder(OrderId orderId);

    /**
     * Cancels the order and releases its items.
     *
     * @param reason free text, stored with the command and the event
     */
    RentalOrderResult cancel(OrderId orderId, String reason);

    /**
     * Reverts the most recent transition.
     */
    CommandRecord undo();

    CommandRecord redo();

    List<CommandRecord> getHistory();

    boolean canUndo();

    boolean canRedo();

    StateInfo getStateInfo(OrderId orderId);

    RentalOrderResult getOrder(OrderId orderId);

    /**
     * Deletes a PENDING or CANCELLED order and releases its items. Its number is not reused.
     */
    void deleteOrder(OrderId orderId);
}
