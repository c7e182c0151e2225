package com.householdledger.recurring.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Current GBP/USD rate as maintained by the sheet sync; one row per day.
 */
@Entity
@Table(name = "fx_rate_current")
public class FxRateEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "date", nullable = false, unique = true)
    private LocalDate date;

    @Column(name = "gbpusd_rate", nullable = false, precision = 10, scale = 6)
    private BigDecimal gbpUsdRate;

    public FxRateEntity() {}

    public FxRateEntity(UUID id, LocalDate date, BigDecimal gbpUsdRate) {
        this.id = id;
        this.date = date;
        this.gbpUsdRate = gbpUsdRate;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public BigDecimal getGbpUsdRate() { return gbpUsdRate; }
    public void setGbpUsdRate(BigDecimal gbpUsdRate) { this.gbpUsdRate = gbpUsdRate; }
}
