package com.example.rental.application.command;

import com.example.rental.application.port.out.RentalOrderPort;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.TransitionAction;

public class ConfirmOrderCommand extends AbstractTransitionCommand {

    public ConfirmOrderCommand(OrderId orderId, RentalOrderPort orderPort, OrderStateMachine stateMachine) {
        super(orderId, TransitionAction.CONFIRM, orderPort, stateMachine);
    }

    @Override
    public String name() {
        return "ConfirmOrder";
    }
}
