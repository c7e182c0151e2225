package com.householdledger.recurring.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DetectedRecurringPayment(
        String patternKey,
        String displayName,
        Frequency frequency,
        BigDecimal averageAmount,
        LocalDate nextExpectedDate,
        int transactionCount,
        LocalDate lastTransactionDate
) {
}
