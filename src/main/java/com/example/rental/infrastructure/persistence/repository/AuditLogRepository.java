package com.example.rental.infrastructure.persistence.repository;

import com.example.rental.infrastructure.persistence.entity.AuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA Repository for the persisted audit trail.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntity, String> {

    @Query("SELECT a FROM AuditLogEntity a WHERE a.orderId = :orderId ORDER BY a.occurredAt ASC")
    List<AuditLogEntity> findByOrderId(@Param("orderId") String orderId);

    long countByEventType(String eventType);
}
