package com.aera.backend.global.jpa;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;

import org.hibernate.Hibernate;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Base for household rows keyed by a generated UUID. Timestamps come from JPA auditing;
 * identity is the id once assigned, so a lazy proxy equals the row it stands for.
 */
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class AbstractTimestampedEntity {

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public abstract UUID getId();

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AbstractTimestampedEntity entity)
                || Hibernate.getClass(this) != Hibernate.getClass(other)) {
            return false;
        }
        UUID id = getId();
        return id != null && Objects.equals(id, entity.getId());
    }

    @Override
    public final int hashCode() {
        // unsaved rows have no id yet
        return Hibernate.getClass(this).hashCode();
    }
}
