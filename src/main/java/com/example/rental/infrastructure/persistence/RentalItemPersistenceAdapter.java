package com.example.rental.infrastructure.persistence;

import com.example.rental.application.port.out.RentalItemPort;
import com.example.rental.domain.model.ItemId;
import com.example.rental.domain.model.RentalItem;
import com.example.rental.infrastructure.persistence.entity.RentalItemEntity;
import com.example.rental.infrastructure.persistence.mapper.RentalOrderPersistenceMapper;
import com.example.rental.infrastructure.persistence.repository.RentalItemJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JPA-backed implementation of {@link RentalItemPort}.
 * Only the availability flag is written back; the catalogue owns everything else.
 */
@Component
public class RentalItemPersistenceAdapter implements RentalItemPort {

    private final RentalItemJpaRepository repository;
    private final RentalOrderPersistenceMapper mapper;

    public RentalItemPersistenceAdapter(RentalItemJpaRepository repository, RentalOrderPersistenceMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RentalItem> findAllById(Collection<ItemId> itemIds) {
        List<String> ids = itemIds.stream().map(ItemId::getValue).toList();
        return repository.findAllById(ids).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void saveAll(Collection<RentalItem> items) {
        List<String> ids = items.stream().map(item -> item.getItemId().getValue()).toList();
        Map<String, RentalItemEntity> entities = repository.findAllById(ids).stream()
                .collect(Collectors.toMap(RentalItemEntity::getId, Function.identity()));
        for (RentalItem item : items) {
            RentalItemEntity entity = entities.get(item.getItemId().getValue());
            if (entity == null) {
                throw new IllegalStateException("Rental item not found: " + item.getItemId());
            }
            entity.setAvailable(item.isAvailable());
        }
        repository.saveAll(entities.values());
    }

    /**
     * Registers a new item as available.
     * <p>
     * Seed hook for catalogue loaders and test fixtures. Catalogue maintenance is not part of
     * the order lifecycle, so no use case calls it; items only change availability through
     * {@link #saveAll}.
     */
    @Transactional
    public RentalItem register(ItemId itemId, String reference) {
        return mapper.toDomain(repository.save(new RentalItemEntity(itemId.getValue(), reference, true)));
    }
}
