package com.example.rental.application.command;

import com.example.rental.application.port.out.RentalItemPort;
import com.example.rental.application.port.out.RentalOrderPort;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.TransitionAction;
import org.springframework.stereotype.Component;

/**
 * Builds transition commands wired to their collaborators.
 */
@Component
public class TransitionCommandFactory {

    private final RentalOrderPort orderPort;
    private final RentalItemPort itemPort;
    private final OrderStateMachine stateMachine;

    public TransitionCommandFactory(RentalOrderPort orderPort, RentalItemPort itemPort,
                                    OrderStateMachine stateMachine) {
        this.orderPort = orderPort;
        this.itemPort = itemPort;
        this.stateMachine = stateMachine;
    }

    public ConfirmOrderCommand confirm(OrderId orderId) {
        return new ConfirmOrderCommand(orderId, orderPort, stateMachine);
    }

    public DeliverOrderCommand deliver(OrderId orderId) {
        return new DeliverOrderCommand(orderId, orderPort, stateMachine);
    }

    public ReturnOrderCommand returnOrder(OrderId orderId) {
        return new ReturnOrderCommand(orderId, orderPort, stateMachine);
    }

    public CancelOrderCommand cancel(OrderId orderId, String reason) {
        return new CancelOrderCommand(orderId, reason, orderPort, itemPort, stateMachine);
    }

    public TransitionCommand create(TransitionAction action, OrderId orderId) {
        return switch (action) {
            case CONFIRM -> confirm(orderId);
            case DELIVER -> deliver(orderId);
            case RETURN -> returnOrder(orderId);
            case CANCEL -> cancel(orderId, null);
        };
    }
}
