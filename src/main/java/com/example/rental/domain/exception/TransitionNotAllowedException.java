package com.example.rental.domain.exception;

import com.example.rental.domain.model.OrderState;
import com.example.rental.domain.statemachine.TransitionAction;

import java.util.List;

/**
 * Exception thrown when a lifecycle action is not allowed from the order's current state,
 * or when an undo would restore a state the order could not have come from.
 */
public class TransitionNotAllowedException extends DomainException {

    private final OrderState currentState;
    private final String attempted;
    private final List<OrderState> allowedTransitions;

    public TransitionNotAllowedException(OrderState currentState, TransitionAction action,
                                         List<OrderState> allowedTransitions) {
        this(currentState, action, allowedTransitions, null);
    }

    public TransitionNotAllowedException(OrderState currentState, TransitionAction action,
                                         List<OrderState> allowedTransitions, String reason) {
        super(String.format("Cannot %s an order in state %s%s. Allowed transitions: %s",
                action.verb(), currentState, reason == null ? "" : ": " + reason, allowedTransitions));
        this.currentState = currentState;
        this.attempted = action.name();
        this.allowedTransitions = List.copyOf(allowedTransitions);
    }

    /**
     * Rejected reversal of an undo.
     */
    public TransitionNotAllowedException(OrderState currentState, OrderState restoredState, String reason) {
        super(String.format("Cannot restore an order in state %s to %s: %s", currentState, restoredState, reason));
        this.currentState = currentState;
        this.attempted = "RESTORE_" + restoredState;
        this.allowedTransitions = List.of();
    }

    public OrderState getCurrentState() {
        return currentState;
    }

    /**
     * The rejected action name, or {@code RESTORE_<state>} for rejected reversals.
     */
    public String getAttempted() {
        return attempted;
    }

    public List<OrderState> getAllowedTransitions() {
        return allowedTransitions;
    }
}
