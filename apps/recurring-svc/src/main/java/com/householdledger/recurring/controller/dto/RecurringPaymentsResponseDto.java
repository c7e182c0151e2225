package com.householdledger.recurring.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record RecurringPaymentsResponseDto(
        String currency,
        BigDecimal fxRate,
        LocalDate asOf,
        List<RecurringPaymentDto> monthly,
        List<RecurringPaymentDto> yearly,
        String traceId
) {
    public record RecurringPaymentDto(
            String patternKey,
            String displayName,
            String frequency,
            BigDecimal averageAmount,
            LocalDate nextExpectedDate,
            int transactionCount,
            LocalDate lastTransactionDate,
            boolean ignored
    ) {
    }
}
