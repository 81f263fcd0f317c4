package com.example.rental.domain.statemachine;

import com.example.rental.domain.model.OrderState;

import java.util.List;

/**
 * Read-only view of an order's position in the lifecycle.
 */
public record StateInfo(
        OrderState currentState,
        boolean modifiable,
        boolean deletable,
        boolean terminal,
        List<OrderState> allowedTransitions
) {

    public StateInfo {
        allowedTransitions = List.copyOf(allowedTransitions);
    }
}
