package com.aera.backend.modules.household.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Reservation of a live household or invitation code. Rows are inserted with
 * {@code ON CONFLICT DO NOTHING} so the primary key arbitrates concurrent draws.
 */
@Entity
@Table(name = "share_code")
public class ShareCode {

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = 6)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 16)
    private ShareCodeKind kind;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected ShareCode() {
    }

    public String getCode() {
        return code;
    }

    public ShareCodeKind getKind() {
        return kind;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
