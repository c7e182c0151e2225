package com.householdledger.recurring.detection;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Transactions sharing one pattern key, sorted by date ascending.
 */
record CandidateSeries(String patternKey, List<NormalizedTransaction> transactions) {

    CandidateSeries {
        transactions = List.copyOf(transactions);
    }

    int size() {
        return transactions.size();
    }

    List<LocalDate> dates() {
        return transactions.stream().map(NormalizedTransaction::date).toList();
    }

    List<BigDecimal> magnitudes() {
        return transactions.stream().map(NormalizedTransaction::magnitude).toList();
    }

    LocalDate lastDate() {
        return transactions.get(transactions.size() - 1).date();
    }
}
