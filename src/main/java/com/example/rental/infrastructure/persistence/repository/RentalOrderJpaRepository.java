package com.example.rental.infrastructure.persistence.repository;

import com.example.rental.infrastructure.persistence.entity.RentalOrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA Repository for rental orders.
 */
@Repository
public interface RentalOrderJpaRepository extends JpaRepository<RentalOrderEntity, String> {
}
