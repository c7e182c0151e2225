package com.householdledger.recurring.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record RecurringCommitmentsResponseDto(
        String currency,
        BigDecimal fxRate,
        BigDecimal totalAnnualized,
        List<CommitmentDto> commitments,
        String traceId
) {
    public record CommitmentDto(
            String name,
            BigDecimal annualizedAmount,
            BigDecimal cumulativeAmount,
            boolean topSpend,
            boolean needsReview,
            int rowCount
    ) {
    }
}
