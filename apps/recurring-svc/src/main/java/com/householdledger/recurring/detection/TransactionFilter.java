package com.householdledger.recurring.detection;

import com.householdledger.recurring.model.Transaction;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Restricts the feed to the lookback window and drops non-spend categories.
 */
final class TransactionFilter {

    private final int lookbackMonths;
    private final Set<String> excludedCategories;

    TransactionFilter(DetectionPolicy policy) {
        this.lookbackMonths = policy.lookbackMonths();
        this.excludedCategories = policy.excludedCategories();
    }

    List<Transaction> filter(List<Transaction> transactions, LocalDate today) {
        if (transactions.isEmpty()) {
            return List.of();
        }
        LocalDate windowStart = today.minusMonths(lookbackMonths);
        return transactions.stream()
                .filter(tx -> tx != null && tx.date() != null)
                .filter(tx -> !tx.date().isBefore(windowStart))
                .filter(tx -> !isExcluded(tx.category()))
                .toList();
    }

    private boolean isExcluded(String category) {
        String normalized = category == null ? "" : category.trim();
        return excludedCategories.contains(normalized);
    }
}
