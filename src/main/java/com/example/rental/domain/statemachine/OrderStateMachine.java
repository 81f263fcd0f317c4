package com.example.rental.domain.statemachine;

import com.example.rental.domain.exception.TransitionNotAllowedException;
import com.example.rental.domain.model.OrderSnapshot;
import com.example.rental.domain.model.OrderState;
import com.example.rental.domain.model.RentalOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Transition table for the rental order lifecycle.
 * <pre>
 * PENDING   --confirm--> CONFIRMED --deliver--> DELIVERED --return--> RETURNED
 *    |                      |
 *    +------cancel----------+-----------------> CANCELLED
 * </pre>
 * Decisions are pure: {@link #transition(RentalOrder, TransitionAction)} never mutates the
 * order. Callers apply the outcome and then report it through {@link #entered}.
 */
public class OrderStateMachine {

    /**
     * Delivery is refused while the rental date is further away than this.
     */
    public static final int MAX_DAYS_BEFORE_DELIVERY = 7;

    /**
     * Returns later than this many days after the rental date are flagged late.
     */
    public static final int RETURN_GRACE_DAYS = 3;

    /**
     * Confirmed orders cancelled with less notice than this are flagged.
     */
    public static final int LATE_CANCELLATION_DAYS = 2;

    private static final Map<OrderState, Map<TransitionAction, OrderState>> TRANSITIONS;
    private static final Set<OrderState> MODIFIABLE = EnumSet.of(OrderState.PENDING, OrderState.CONFIRMED);
    private static final Set<OrderState> DELETABLE = EnumSet.of(OrderState.PENDING, OrderState.CANCELLED);

    static {
        Map<OrderState, Map<TransitionAction, OrderState>> table = new EnumMap<>(OrderState.class);
        for (OrderState state : OrderState.values()) {
            table.put(state, new EnumMap<>(TransitionAction.class));
        }
        edge(table, OrderState.PENDING, TransitionAction.CONFIRM);
        edge(table, OrderState.PENDING, TransitionAction.CANCEL);
        edge(table, OrderState.CONFIRMED, TransitionAction.DELIVER);
        edge(table, OrderState.CONFIRMED, TransitionAction.CANCEL);
        edge(table, OrderState.DELIVERED, TransitionAction.RETURN);
        table.replaceAll((state, edges) -> Collections.unmodifiableMap(edges));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    private static void edge(Map<OrderState, Map<TransitionAction, OrderState>> table,
                             OrderState from, TransitionAction action) {
        table.get(from).put(action, action.targetState());
    }

    private final Clock clock;
    private final StateEntryHook hook;

    public OrderStateMachine(Clock clock) {
        this(clock, StateEntryHook.NO_OP);
    }

    public OrderStateMachine(Clock clock, StateEntryHook hook) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.hook = Objects.requireNonNull(hook, "Hook cannot be null");
    }

    /**
     * Decides whether {@code action} may run on the order in its current state.
     *
     * @return the outcome to apply
     * @throws TransitionNotAllowedException if the action is not an edge of the table or a
     *                                       state rule rejects it
     */
    public TransitionOutcome transition(RentalOrder order, TransitionAction action) {
        Objects.requireNonNull(order, "Order cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        OrderState current = order.getState();

        if (!TRANSITIONS.get(current).containsKey(action)) {
            throw new TransitionNotAllowedException(current, action, allowedFrom(current));
        }

        return switch (action) {
            case CONFIRM -> TransitionOutcome.simple(action, current);
            case DELIVER -> deliver(order, current);
            case RETURN -> returnOrder(order, current);
            case CANCEL -> TransitionOutcome.cancelled(current,
                    current == OrderState.CONFIRMED && daysUntilRental(order) < LATE_CANCELLATION_DAYS);
        };
    }

    private TransitionOutcome deliver(RentalOrder order, OrderState current) {
        long daysUntil = daysUntilRental(order);
        if (daysUntil > MAX_DAYS_BEFORE_DELIVERY) {
            throw new TransitionNotAllowedException(current, TransitionAction.DELIVER, allowedFrom(current),
                    "too early to deliver, rental date " + order.getRentalDate() + " is " + daysUntil
                            + " days away (max " + MAX_DAYS_BEFORE_DELIVERY + ")");
        }
        return TransitionOutcome.simple(TransitionAction.DELIVER, current);
    }

    private TransitionOutcome returnOrder(RentalOrder order, OrderState current) {
        Instant returnDate = order.getReturnDate() != null ? order.getReturnDate() : clock.instant();
        LocalDate returnDay = LocalDate.ofInstant(returnDate, clock.getZone());
        long elapsed = ChronoUnit.DAYS.between(order.getRentalDate(), returnDay);
        return TransitionOutcome.returned(current, returnDate, elapsed, elapsed > RETURN_GRACE_DAYS);
    }

    private long daysUntilRental(RentalOrder order) {
        return ChronoUnit.DAYS.between(LocalDate.now(clock), order.getRentalDate());
    }

    /**
     * Reports that {@code order} has had {@code outcome} applied.
     */
    public void entered(RentalOrder order, TransitionOutcome outcome) {
        hook.onEnter(order, outcome);
    }

    /**
     * Checks that an order may be put back from {@code current} into {@code restored}.
     * Allowed only when {@code restored -> current} is an edge of the table.
     *
     * @throws TransitionNotAllowedException otherwise
     */
    public void checkReversal(OrderState current, OrderState restored) {
        Objects.requireNonNull(current, "Current state cannot be null");
        Objects.requireNonNull(restored, "Restored state cannot be null");
        if (!TRANSITIONS.get(restored).containsValue(current)) {
            throw new TransitionNotAllowedException(current, restored,
                    "cannot revert to " + restored + ", " + current + " is not reachable from it");
        }
    }

    /**
     * Checks the reversal, force-restores the snapshot onto the order and reports the entry
     * into the restored state.
     */
    public void revert(RentalOrder order, OrderSnapshot snapshot) {
        OrderState current = order.getState();
        checkReversal(current, snapshot.state());
        if (isTerminal(current)) {
            hook.onTerminalExit(order, current, snapshot.state());
        }
        order.restore(snapshot);
        hook.onRestore(order, current, snapshot.state());
    }

    public List<OrderState> getAllowedTransitions(RentalOrder order) {
        return allowedFrom(order.getState());
    }

    public boolean validateTransition(RentalOrder order, OrderState target) {
        return getAllowedTransitions(order).contains(target);
    }

    public boolean canModify(RentalOrder order) {
        return MODIFIABLE.contains(order.getState());
    }

    public boolean canDelete(RentalOrder order) {
        return DELETABLE.contains(order.getState());
    }

    public boolean isTerminal(OrderState state) {
        return TRANSITIONS.get(state).isEmpty();
    }

    public StateInfo describe(RentalOrder order) {
        OrderState state = order.getState();
        return new StateInfo(state, canModify(order), canDelete(order), isTerminal(state), allowedFrom(state));
    }

    private static List<OrderState> allowedFrom(OrderState state) {
        return Collections.unmodifiableList(new ArrayList<>(TRANSITIONS.get(state).values()));
    }
}
