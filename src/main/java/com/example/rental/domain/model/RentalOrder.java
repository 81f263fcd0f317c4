package com.example.rental.domain.model;

import com.example.rental.domain.statemachine.TransitionOutcome;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate Root representing a rental order (a "service").
 * <p>
 * State changes only come in through {@link #apply(TransitionOutcome)}, decided by the
 * state machine, or {@link #restore(OrderSnapshot)}, used by undo after the reversal has
 * been checked.
 */
public final class RentalOrder {

    private final OrderId orderId;
    private final long number;
    private final LocalDate rentalDate;
    private final Money total;
    private final String customerId;
    private final String staffId;
    private final Set<ItemId> itemIds;
    private final Instant createdAt;
    private OrderState state;
    private Instant returnDate;

    private RentalOrder(OrderId orderId, long number, LocalDate rentalDate, Money total,
                        String customerId, String staffId, Set<ItemId> itemIds,
                        Instant createdAt, OrderState state, Instant returnDate) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.rentalDate = Objects.requireNonNull(rentalDate, "RentalDate cannot be null");
        this.total = Objects.requireNonNull(total, "Total cannot be null");
        this.customerId = Objects.requireNonNull(customerId, "CustomerId cannot be null");
        this.staffId = Objects.requireNonNull(staffId, "StaffId cannot be null");
        this.itemIds = new LinkedHashSet<>(Objects.requireNonNull(itemIds, "ItemIds cannot be null"));
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.number = number;
        this.returnDate = returnDate;

        if (number <= 0) {
            throw new IllegalArgumentException("Order number must be positive: " + number);
        }
        if (this.itemIds.isEmpty()) {
            throw new IllegalArgumentException("Rental order must have at least one item");
        }
        checkReturnDate(state, returnDate);
    }

    /**
     * Creates a new order in {@link OrderState#PENDING}.
     *
     * @param number     sequence number taken from the generator, assigned once
     * @param rentalDate the day the items are due to go out
     * @param total      pre-computed total
     * @param customerId customer reference
     * @param staffId    staff member who registered the order
     * @param itemIds    rented items (must not be empty)
     * @param createdAt  creation timestamp
     * @return new RentalOrder instance
     */
    public static RentalOrder create(long number, LocalDate rentalDate, Money total,
                                     String customerId, String staffId, Set<ItemId> itemIds,
                                     Instant createdAt) {
        return new RentalOrder(OrderId.generate(), number, rentalDate, total, customerId, staffId,
                itemIds, createdAt, OrderState.PENDING, null);
    }

    /**
     * Reconstitutes a RentalOrder from persistence.
     */
    public static RentalOrder reconstitute(OrderId orderId, long number, LocalDate rentalDate, Money total,
                                           String customerId, String staffId, Set<ItemId> itemIds,
                                           Instant createdAt, OrderState state, Instant returnDate) {
        return new RentalOrder(orderId, number, rentalDate, total, customerId, staffId,
                itemIds, createdAt, state, returnDate);
    }

    /**
     * Applies a transition decided by the state machine.
     *
     * @throws IllegalStateException if the outcome was decided for a different current state
     */
    public void apply(TransitionOutcome outcome) {
        Objects.requireNonNull(outcome, "Outcome cannot be null");
        if (outcome.from() != this.state) {
            throw new IllegalStateException(
                    "Outcome computed from " + outcome.from() + " but order " + orderId + " is " + this.state);
        }
        Instant newReturnDate = outcome.to() == OrderState.RETURNED ? outcome.returnDate() : this.returnDate;
        checkReturnDate(outcome.to(), newReturnDate);
        this.state = outcome.to();
        this.returnDate = newReturnDate;
    }

    public OrderSnapshot snapshot() {
        return new OrderSnapshot(state, returnDate);
    }

    /**
     * Force-restores state and return date. Callers check the reversal first.
     */
    public void restore(OrderSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        checkReturnDate(snapshot.state(), snapshot.returnDate());
        this.state = snapshot.state();
        this.returnDate = snapshot.returnDate();
    }

    private static void checkReturnDate(OrderState state, Instant returnDate) {
        if (state == OrderState.RETURNED && returnDate == null) {
            throw new IllegalStateException("Returned order must carry a return date");
        }
        if (state != OrderState.RETURNED && returnDate != null) {
            throw new IllegalStateException("Return date is only set on returned orders, state is " + state);
        }
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public long getNumber() {
        return number;
    }

    public LocalDate getRentalDate() {
        return rentalDate;
    }

    public Money getTotal() {
        return total;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getStaffId() {
        return staffId;
    }

    public Set<ItemId> getItemIds() {
        return Collections.unmodifiableSet(itemIds);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public OrderState getState() {
        return state;
    }

    public Instant getReturnDate() {
        return returnDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RentalOrder that = (RentalOrder) o;
        return Objects.equals(orderId, that.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId);
    }

    @Override
    public String toString() {
        return "RentalOrder{" +
                "orderId=" + orderId +
                ", number=" + number +
                ", state=" + state +
                ", rentalDate=" + rentalDate +
                ", itemCount=" + itemIds.size() +
                '}';
    }
}
