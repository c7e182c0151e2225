package com.householdledger.recurring.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "recurring_preferences",
        uniqueConstraints = @UniqueConstraint(name = "recurring_preferences_pattern_unique", columnNames = {"counterparty_pattern"})
)
public class RecurringPreferenceEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "counterparty_pattern", nullable = false)
    private String counterpartyPattern;

    @Column(name = "is_ignored", nullable = false)
    private boolean ignored;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected RecurringPreferenceEntity() {
    }

    public RecurringPreferenceEntity(String counterpartyPattern, boolean ignored) {
        this(UUID.randomUUID(), counterpartyPattern, ignored);
    }

    public RecurringPreferenceEntity(UUID id, String counterpartyPattern, boolean ignored) {
        this.id = id;
        this.counterpartyPattern = counterpartyPattern;
        this.ignored = ignored;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getCounterpartyPattern() {
        return counterpartyPattern;
    }

    public boolean isIgnored() {
        return ignored;
    }

    public void setIgnored(boolean ignored) {
        this.ignored = ignored;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
