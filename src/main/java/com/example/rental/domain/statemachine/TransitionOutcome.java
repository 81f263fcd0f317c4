package com.example.rental.domain.statemachine;

import com.example.rental.domain.model.OrderState;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of an accepted transition.
 *
 * @param action            the action that was requested
 * @param from              state before the transition
 * @param to                state after the transition
 * @param returnDate        stamped return timestamp, only for {@link TransitionAction#RETURN}
 * @param elapsedDays       days from the rental date to the return, only for returns
 * @param lateReturn        true when the return came after the grace period
 * @param lateCancellation  true when a confirmed order was cancelled too close to the rental date
 */
public record TransitionOutcome(
        TransitionAction action,
        OrderState from,
        OrderState to,
        Instant returnDate,
        long elapsedDays,
        boolean lateReturn,
        boolean lateCancellation
) {

    public TransitionOutcome {
        Objects.requireNonNull(action, "Action cannot be null");
        Objects.requireNonNull(from, "From state cannot be null");
        Objects.requireNonNull(to, "To state cannot be null");
    }

    public static TransitionOutcome simple(TransitionAction action, OrderState from) {
        return new TransitionOutcome(action, from, action.targetState(), null, 0, false, false);
    }

    public static TransitionOutcome returned(OrderState from, Instant returnDate, long elapsedDays, boolean late) {
        Objects.requireNonNull(returnDate, "Return date cannot be null");
        return new TransitionOutcome(TransitionAction.RETURN, from, OrderState.RETURNED,
                returnDate, elapsedDays, late, false);
    }

    public static TransitionOutcome cancelled(OrderState from, boolean lateCancellation) {
        return new TransitionOutcome(TransitionAction.CANCEL, from, OrderState.CANCELLED,
                null, 0, false, lateCancellation);
    }

    /**
     * Days past the grace period, 0 when the return was on time.
     */
    public long daysLate() {
        return lateReturn ? elapsedDays - OrderStateMachine.RETURN_GRACE_DAYS : 0;
    }
}
