package com.example.rental.infrastructure.persistence.mapper;

import com.example.rental.domain.model.ItemId;
import com.example.rental.domain.model.Money;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.OrderState;
import com.example.rental.domain.model.RentalItem;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.infrastructure.persistence.entity.OrderStateEnum;
import com.example.rental.infrastructure.persistence.entity.RentalItemEntity;
import com.example.rental.infrastructure.persistence.entity.RentalOrderEntity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mapper between the rental domain model and its JPA entities.
 */
@Component
public class RentalOrderPersistenceMapper {

    /**
     * Copies the order onto {@code entity}, a fresh or already managed instance.
     */
    public RentalOrderEntity toEntity(RentalOrder order, RentalOrderEntity entity) {
        entity.setId(order.getOrderId().getValue());
        entity.setOrderNumber(order.getNumber());
        entity.setState(toStateEnum(order.getState()));
        entity.setRentalDate(order.getRentalDate());
        entity.setReturnDate(order.getReturnDate());
        entity.setTotalAmount(order.getTotal().getAmount());
        entity.setCurrency(order.getTotal().getCurrency());
        entity.setCustomerId(order.getCustomerId());
        entity.setStaffId(order.getStaffId());
        entity.setCreatedAt(order.getCreatedAt());

        Set<String> itemIds = order.getItemIds().stream()
                .map(ItemId::getValue)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        entity.getItemIds().retainAll(itemIds);
        entity.getItemIds().addAll(itemIds);
        return entity;
    }

    public RentalOrder toDomain(RentalOrderEntity entity) {
        Set<ItemId> itemIds = entity.getItemIds().stream()
                .map(ItemId::of)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        return RentalOrder.reconstitute(
                OrderId.of(entity.getId()),
                entity.getOrderNumber(),
                entity.getRentalDate(),
                Money.of(entity.getTotalAmount(), entity.getCurrency()),
                entity.getCustomerId(),
                entity.getStaffId(),
                itemIds,
                entity.getCreatedAt(),
                toDomainState(entity.getState()),
                entity.getReturnDate()
        );
    }

    public RentalItem toDomain(RentalItemEntity entity) {
        return new RentalItem(ItemId.of(entity.getId()), entity.getReference(), entity.isAvailable());
    }

    public OrderStateEnum toStateEnum(OrderState state) {
        return switch (state) {
            case PENDING -> OrderStateEnum.PENDING;
            case CONFIRMED -> OrderStateEnum.CONFIRMED;
            case DELIVERED -> OrderStateEnum.DELIVERED;
            case RETURNED -> OrderStateEnum.RETURNED;
            case CANCELLED -> OrderStateEnum.CANCELLED;
        };
    }

    public OrderState toDomainState(OrderStateEnum state) {
        return switch (state) {
            case PENDING -> OrderState.PENDING;
            case CONFIRMED -> OrderState.CONFIRMED;
            case DELIVERED -> OrderState.DELIVERED;
            case RETURNED -> OrderState.RETURNED;
            case CANCELLED -> OrderState.CANCELLED;
        };
    }
}
