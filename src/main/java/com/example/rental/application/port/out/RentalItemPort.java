package com.example.rental.application.port.out;

import com.example.rental.domain.model.ItemId;
import com.example.rental.domain.model.RentalItem;

import java.util.Collection;
import java.util.List;

/**
 * Outbound port for item availability.
 */
public interface RentalItemPort {

    /**
     * Loads the given items. Unknown ids are left out of the result.
     */
    List<RentalItem> findAllById(Collection<ItemId> itemIds);

    void saveAll(Collection<RentalItem> items);
}
