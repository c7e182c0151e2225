package com.householdledger.recurring.model;

import java.math.BigDecimal;

/**
 * Sheet rows sharing one name, merged and converted to the display currency.
 *
 * @param cumulativeAmount running total of absolute amounts, largest commitment first
 * @param topSpend whether this commitment falls within the top 80% of cumulative spend
 */
public record RecurringCommitment(
        String name,
        BigDecimal annualizedAmount,
        BigDecimal cumulativeAmount,
        boolean topSpend,
        boolean needsReview,
        int rowCount
) {
}
