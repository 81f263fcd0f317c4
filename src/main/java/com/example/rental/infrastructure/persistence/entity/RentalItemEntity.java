package com.example.rental.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Availability record of a rentable item.
 */
@Entity
@Table(name = "rental_items")
public class RentalItemEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "reference", length = 100, nullable = false)
    private String reference;

    @Column(name = "available", nullable = false)
    private boolean available;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected RentalItemEntity() {
    }

    public RentalItemEntity(String id, String reference, boolean available) {
        this.id = id;
        this.reference = reference;
        this.available = available;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getReference() {
        return reference;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
