package com.example.rental.domain.statemachine;

import com.example.rental.domain.model.OrderState;
import com.example.rental.domain.model.RentalOrder;

/**
 * Callback invoked by {@link OrderStateMachine} around state changes.
 */
public interface StateEntryHook {

    StateEntryHook NO_OP = new StateEntryHook() {
    };

    /**
     * Called after the order entered {@code outcome.to()}.
     */
    default void onEnter(RentalOrder order, TransitionOutcome outcome) {
    }

    /**
     * Called when an order leaves a terminal state. Only reachable through undo.
     */
    default void onTerminalExit(RentalOrder order, OrderState terminalState, OrderState restoredState) {
    }

    /**
     * Called after undo put the order back into {@code restoredState}, the entry counterpart of
     * {@link #onEnter} for reversals.
     */
    default void onRestore(RentalOrder order, OrderState fromState, OrderState restoredState) {
    }
}
