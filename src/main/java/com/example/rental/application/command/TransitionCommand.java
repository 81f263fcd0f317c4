package com.example.rental.application.command;

import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.domain.statemachine.TransitionOutcome;

import java.util.Map;
import java.util.Optional;

/**
 * A reversible lifecycle transition on one rental order.
 * <p>
 * {@link #execute()} captures everything {@link #undo()} needs before changing anything.
 * Executing again after an undo is how redo works.
 */
public interface TransitionCommand {

    /**
     * Runs the transition and persists the result.
     *
     * @return the order after the transition
     * @throws com.example.rental.domain.exception.OrderNotFoundException if the order does not exist
     * @throws com.example.rental.domain.exception.TransitionNotAllowedException if the state machine rejects it
     */
    RentalOrder execute();

    /**
     * Restores the state captured by the last {@link #execute()}.
     *
     * @throws IllegalStateException if the command has not been executed
     */
    void undo();

    String name();

    OrderId orderId();

    /**
     * Parameters for the audit trail, including previous and new state once executed.
     */
    Map<String, Object> params();

    /**
     * Outcome of the last successful execution.
     */
    Optional<TransitionOutcome> outcome();
}
