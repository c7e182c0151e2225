package com.householdledger.recurring.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A row of the hand-maintained recurring payments sheet. Names are free text and may repeat.
 */
@Entity
@Table(name = "recurring_payments")
public class RecurringCommitmentEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "annualized_amount_gbp", precision = 15, scale = 2)
    private BigDecimal annualizedAmountGbp;

    @Column(name = "annualized_amount_usd", precision = 15, scale = 2)
    private BigDecimal annualizedAmountUsd;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected RecurringCommitmentEntity() {
    }

    public RecurringCommitmentEntity(String name, BigDecimal annualizedAmountGbp, BigDecimal annualizedAmountUsd, boolean needsReview) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.annualizedAmountGbp = annualizedAmountGbp;
        this.annualizedAmountUsd = annualizedAmountUsd;
        this.needsReview = needsReview;
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

    public String getName() {
        return name;
    }

    public BigDecimal getAnnualizedAmountGbp() {
        return annualizedAmountGbp;
    }

    public BigDecimal getAnnualizedAmountUsd() {
        return annualizedAmountUsd;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public void setNeedsReview(boolean needsReview) {
        this.needsReview = needsReview;
    }
}
