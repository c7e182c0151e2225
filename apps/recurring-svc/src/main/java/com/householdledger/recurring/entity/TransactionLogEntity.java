package com.householdledger.recurring.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "transaction_log")
public class TransactionLogEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "category", nullable = false)
    private String category;

    @Column(name = "counterparty")
    private String counterparty;

    @Column(name = "amount_usd", precision = 15, scale = 2)
    private BigDecimal amountUsd;

    @Column(name = "amount_gbp", precision = 15, scale = 2)
    private BigDecimal amountGbp;

    @Column(name = "created_at")
    private Instant createdAt;

    // Default constructor for JPA
    public TransactionLogEntity() {}

    public TransactionLogEntity(UUID id, LocalDate date, String category, String counterparty,
                                BigDecimal amountUsd, BigDecimal amountGbp, Instant createdAt) {
        this.id = id;
        this.date = date;
        this.category = category;
        this.counterparty = counterparty;
        this.amountUsd = amountUsd;
        this.amountGbp = amountGbp;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getCounterparty() { return counterparty; }
    public void setCounterparty(String counterparty) { this.counterparty = counterparty; }

    public BigDecimal getAmountUsd() { return amountUsd; }
    public void setAmountUsd(BigDecimal amountUsd) { this.amountUsd = amountUsd; }

    public BigDecimal getAmountGbp() { return amountGbp; }
    public void setAmountGbp(BigDecimal amountGbp) { this.amountGbp = amountGbp; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
