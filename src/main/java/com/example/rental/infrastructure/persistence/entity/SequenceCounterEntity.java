package com.example.rental.infrastructure.persistence.entity;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One row per named counter. Only ever incremented under a row lock.
 * New instances are inserted with {@code persist}, never merged, so a concurrently created
 * row is reported as a key violation instead of being overwritten.
 */
@Entity
@Table(name = "sequence_counters")
public class SequenceCounterEntity implements Persistable<String> {

    @Id
    @Column(name = "counter_name", length = 50)
    private String counterName;

    @Column(name = "last_value", nullable = false)
    private long lastValue;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Transient
    private boolean newEntity = true;

    protected SequenceCounterEntity() {
    }

    public SequenceCounterEntity(String counterName, long lastValue, Instant lastUpdated) {
        this.counterName = counterName;
        this.lastValue = lastValue;
        this.lastUpdated = lastUpdated;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }

    @Override
    public String getId() {
        return counterName;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    /**
     * Advances the counter by one.
     *
     * @return the new value
     */
    public long increment(Instant now) {
        this.lastValue++;
        this.lastUpdated = now;
        return lastValue;
    }

    public void overwrite(long value, Instant now) {
        this.lastValue = value;
        this.lastUpdated = now;
    }

    public String getCounterName() {
        return counterName;
    }

    public long getLastValue() {
        return lastValue;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }
}
