package com.example.rental.application.dto;

import com.example.rental.domain.model.RentalOrder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Read model of a rental order returned by the use case.
 */
public record RentalOrderResult(
        String orderId,
        long number,
        String state,
        LocalDate rentalDate,
        Instant returnDate,
        BigDecimal total,
        String currency,
        String customerId,
        String staffId,
        List<String> itemIds,
        Instant createdAt
) {
    public static RentalOrderResult from(RentalOrder order) {
        return new RentalOrderResult(
                order.getOrderId().getValue(),
                order.getNumber(),
                order.getState().name(),
                order.getRentalDate(),
                order.getReturnDate(),
                order.getTotal().getAmount(),
                order.getTotal().getCurrency(),
                order.getCustomerId(),
                order.getStaffId(),
                order.getItemIds().stream().map(Object::toString).toList(),
                order.getCreatedAt()
        );
    }
}
