package com.example.rental.application.command;

import com.example.rental.application.port.out.RentalOrderPort;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.TransitionAction;

import java.util.Map;

/**
 * Marks the items as returned. The return timestamp is part of the snapshot, so undo clears it.
 */
public class ReturnOrderCommand extends AbstractTransitionCommand {

    public ReturnOrderCommand(OrderId orderId, RentalOrderPort orderPort, OrderStateMachine stateMachine) {
        super(orderId, TransitionAction.RETURN, orderPort, stateMachine);
    }

    @Override
    public String name() {
        return "ReturnOrder";
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = super.params();
        outcome().ifPresent(o -> {
            params.put("returnDate", o.returnDate().toString());
            params.put("lateReturn", o.lateReturn());
        });
        return params;
    }
}
