package com.example.rental.application.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Command for registering a new rental order.
 * The total is priced upstream and carried as is.
 */
public record CreateRentalOrderCommand(
        String customerId,
        String staffId,
        LocalDate rentalDate,
        List<String> itemIds,
        BigDecimal total
) {
    public CreateRentalOrderCommand {
        Objects.requireNonNull(customerId, "CustomerId cannot be null");
        Objects.requireNonNull(staffId, "StaffId cannot be null");
        Objects.requireNonNull(rentalDate, "RentalDate cannot be null");
        Objects.requireNonNull(itemIds, "ItemIds cannot be null");
        Objects.requireNonNull(total, "Total cannot be null");
        if (customerId.isBlank()) {
            throw new IllegalArgumentException("CustomerId cannot be blank");
        }
        if (staffId.isBlank()) {
            throw new IllegalArgumentException("StaffId cannot be blank");
        }
        if (itemIds.isEmpty()) {
            throw new IllegalArgumentException("ItemIds cannot be empty");
        }
        if (total.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Total cannot be negative");
        }
        itemIds = List.copyOf(itemIds);
    }
}
