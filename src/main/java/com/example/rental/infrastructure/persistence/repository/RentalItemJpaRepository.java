package com.example.rental.infrastructure.persistence.repository;

import com.example.rental.infrastructure.persistence.entity.RentalItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RentalItemJpaRepository extends JpaRepository<RentalItemEntity, String> {
}
