package com.example.rental.application.port.out;

import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.RentalOrder;

import java.util.Optional;

/**
 * Outbound port for rental order persistence.
 */
public interface RentalOrderPort {

    Optional<RentalOrder> findById(OrderId orderId);

    /**
     * Inserts or updates the order.
     *
     * @param order the order to store
     * @return the stored order
     */
    RentalOrder save(RentalOrder order);

    void delete(OrderId orderId);
}
