package com.example.rental.application.command;

import com.example.rental.application.port.out.RentalOrderPort;
import com.example.rental.domain.exception.OrderNotFoundException;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.OrderSnapshot;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.TransitionAction;
import com.example.rental.domain.statemachine.TransitionOutcome;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Load, snapshot, decide, apply, persist. Subclasses only add side effects on related data.
 */
public abstract class AbstractTransitionCommand implements TransitionCommand {

    private final OrderId orderId;
    private final TransitionAction action;
    protected final RentalOrderPort orderPort;
    protected final OrderStateMachine stateMachine;

    private OrderSnapshot before;
    private TransitionOutcome outcome;
    // Stays set after undo: a second undo is refused by the reversal check.
    private boolean executed;

    protected AbstractTransitionCommand(OrderId orderId, TransitionAction action,
                                        RentalOrderPort orderPort, OrderStateMachine stateMachine) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.action = Objects.requireNonNull(action, "Action cannot be null");
        this.orderPort = Objects.requireNonNull(orderPort, "OrderPort cannot be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "StateMachine cannot be null");
    }

    @Override
    public final RentalOrder execute() {
        RentalOrder order = loadOrder();
        OrderSnapshot snapshot = order.snapshot();
        TransitionOutcome decided = stateMachine.transition(order, action);

        beforeApply(order);
        order.apply(decided);
        RentalOrder saved = orderPort.save(order);
        afterApply(saved, decided);
        stateMachine.entered(saved, decided);

        this.before = snapshot;
        this.outcome = decided;
        this.executed = true;
        return saved;
    }

    @Override
    public final void undo() {
        if (!executed) {
            throw new IllegalStateException("Cannot undo " + name() + " on order " + orderId + ": not executed");
        }
        RentalOrder order = loadOrder();
        stateMachine.revert(order, before);
        RentalOrder saved = orderPort.save(order);
        afterUndo(saved);
    }

    /**
     * Hook run after the transition was accepted but before it is applied.
     */
    protected void beforeApply(RentalOrder order) {
    }

    protected void afterApply(RentalOrder order, TransitionOutcome outcome) {
    }

    protected void afterUndo(RentalOrder order) {
    }

    private RentalOrder loadOrder() {
        return orderPort.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Override
    public OrderId orderId() {
        return orderId;
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("orderId", orderId.getValue());
        params.put("action", action.name());
        if (outcome != null) {
            params.put("previousState", outcome.from().name());
            params.put("newState", outcome.to().name());
        }
        return params;
    }

    @Override
    public Optional<TransitionOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    @Override
    public String toString() {
        return name() + "{orderId=" + orderId + ", executed=" + executed + '}';
    }
}
