package com.example.rental.infrastructure.persistence.repository;

import com.example.rental.infrastructure.persistence.entity.SequenceCounterEntity;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * JPA Repository for named sequence counters.
 */
@Repository
public interface SequenceCounterRepository extends JpaRepository<SequenceCounterEntity, String> {

    /**
     * Reads the counter row with {@code SELECT ... FOR UPDATE}. Must run inside a transaction;
     * the lock is held until it ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "10000"))
    @Query("SELECT c FROM SequenceCounterEntity c WHERE c.counterName = :name")
    Optional<SequenceCounterEntity> findForUpdate(@Param("name") String counterName);
}
