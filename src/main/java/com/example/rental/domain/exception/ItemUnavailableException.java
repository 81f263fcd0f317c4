package com.example.rental.domain.exception;

import com.example.rental.domain.model.ItemId;

import java.util.List;

/**
 * Exception thrown when an order is created with items that are missing or already rented.
 */
public class ItemUnavailableException extends DomainException {

    private final List<ItemId> unavailable;
    private final List<ItemId> missing;

    public ItemUnavailableException(List<ItemId> unavailable, List<ItemId> missing) {
        super(String.format("Items cannot be rented: unavailable %s, unknown %s", unavailable, missing));
        this.unavailable = List.copyOf(unavailable);
        this.missing = List.copyOf(missing);
    }

    public List<ItemId> getUnavailable() {
        return unavailable;
    }

    public List<ItemId> getMissing() {
        return missing;
    }
}
