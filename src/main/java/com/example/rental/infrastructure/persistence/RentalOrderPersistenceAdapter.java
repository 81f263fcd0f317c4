package com.example.rental.infrastructure.persistence;

import com.example.rental.application.port.out.RentalOrderPort;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.infrastructure.persistence.entity.RentalOrderEntity;
import com.example.rental.infrastructure.persistence.mapper.RentalOrderPersistenceMapper;
import com.example.rental.infrastructure.persistence.repository.RentalOrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * JPA-backed implementation of {@link RentalOrderPort}.
 */
@Component
public class RentalOrderPersistenceAdapter implements RentalOrderPort {

    private static final Logger log = LoggerFactory.getLogger(RentalOrderPersistenceAdapter.class);

    private final RentalOrderJpaRepository repository;
    private final RentalOrderPersistenceMapper mapper;

    public RentalOrderPersistenceAdapter(RentalOrderJpaRepository repository, RentalOrderPersistenceMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RentalOrder> findById(OrderId orderId) {
        return repository.findById(orderId.getValue()).map(mapper::toDomain);
    }

    @Override
    @Transactional
    public RentalOrder save(RentalOrder order) {
        RentalOrderEntity entity = repository.findById(order.getOrderId().getValue())
                .orElseGet(RentalOrderEntity::new);
        RentalOrderEntity saved = repository.save(mapper.toEntity(order, entity));
        log.debug("Saved rental order {} state={}", saved.getId(), saved.getState());
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional
    public void delete(OrderId orderId) {
        repository.deleteById(orderId.getValue());
    }
}
