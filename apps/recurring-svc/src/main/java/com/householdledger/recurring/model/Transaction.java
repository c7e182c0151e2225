package com.householdledger.recurring.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single row of the household transaction log. Amounts are signed; outflows are negative.
 * Either amount may be null when the sheet row only carries the other currency.
 */
public record Transaction(
        UUID id,
        LocalDate date,
        String category,
        String counterparty,
        BigDecimal amountUsd,
        BigDecimal amountGbp
) {
    public boolean hasCounterparty() {
        return counterparty != null && !counterparty.isBlank();
    }

    public BigDecimal amountIn(DisplayCurrency currency) {
        return currency == DisplayCurrency.USD ? amountUsd : amountGbp;
    }
}
