package com.example.rental.domain.model;

import java.util.Objects;

/**
 * Value Object referencing a rentable item (garment, costume, suit).
 */
public final class ItemId implements Comparable<ItemId> {

    private final String value;

    private ItemId(String value) {
        this.value = value;
    }

    /**
     * Creates an ItemId.
     *
     * @param value the item reference key
     * @return new ItemId
     * @throws IllegalArgumentException if the value is blank or longer than 36 characters
     */
    public static ItemId of(String value) {
        Objects.requireNonNull(value, "ItemId value cannot be null");
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("ItemId cannot be blank");
        }
        if (trimmed.length() > 36) {
            throw new IllegalArgumentException("ItemId cannot exceed 36 characters: " + trimmed);
        }
        return new ItemId(trimmed);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ItemId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ItemId other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
