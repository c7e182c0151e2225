package com.householdledger.recurring.model;

import java.math.BigDecimal;
import java.util.List;

public record CommitmentRegister(
        DisplayCurrency currency,
        BigDecimal fxRate,
        BigDecimal totalAnnualized,
        List<RecurringCommitment> commitments
) {
    public CommitmentRegister {
        commitments = List.copyOf(commitments);
    }
}
