package com.example.rental.domain.statemachine;

import com.example.rental.domain.model.OrderState;

/**
 * Lifecycle actions, each with a fixed target state.
 */
public enum TransitionAction {

    CONFIRM(OrderState.CONFIRMED),
    DELIVER(OrderState.DELIVERED),
    RETURN(OrderState.RETURNED),
    CANCEL(OrderState.CANCELLED);

    private final OrderState targetState;

    TransitionAction(OrderState targetState) {
        this.targetState = targetState;
    }

    public OrderState targetState() {
        return targetState;
    }

    public String verb() {
        return name().toLowerCase();
    }
}
