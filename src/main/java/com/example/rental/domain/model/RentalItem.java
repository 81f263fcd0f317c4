package com.example.rental.domain.model;

import java.util.Objects;

/**
 * A rentable item as seen by the order lifecycle: identity plus availability flag.
 * Catalogue details (size, colour, laundry status) belong to the inventory side.
 */
public final class RentalItem {

    private final ItemId itemId;
    private final String reference;
    private boolean available;

    public RentalItem(ItemId itemId, String reference, boolean available) {
        this.itemId = Objects.requireNonNull(itemId, "ItemId cannot be null");
        this.reference = Objects.requireNonNull(reference, "Reference cannot be null");
        this.available = available;
    }

    public void markAvailable() {
        this.available = true;
    }

    public void markRented() {
        this.available = false;
    }

    /**
     * Sets availability directly. Used when reverting a cancellation.
     */
    public void restoreAvailability(boolean available) {
        this.available = available;
    }

    public ItemId getItemId() {
        return itemId;
    }

    public String getReference() {
        return reference;
    }

    public boolean isAvailable() {
        return available;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RentalItem item)) return false;
        return itemId.equals(item.itemId);
    }

    @Override
    public int hashCode() {
        return itemId.hashCode();
    }

    @Override
    public String toString() {
        return "RentalItem{" + itemId + " (" + reference + "), available=" + available + '}';
    }
}
