package com.example.rental.domain.exception;

import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.OrderState;

public class OrderNotDeletableException extends DomainException {

    private final OrderId orderId;
    private final OrderState state;

    public OrderNotDeletableException(OrderId orderId, OrderState state) {
        super("Rental order " + orderId + " cannot be deleted in state " + state
                + ". Only PENDING or CANCELLED orders can be deleted");
        this.orderId = orderId;
        this.state = state;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public OrderState getState() {
        return state;
    }
}
