package com.householdledger.recurring.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.householdledger.recurring.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TransactionFilterTest {

    private final TransactionFilter filter = new TransactionFilter(DetectionPolicy.defaults());

    private final LocalDate today = LocalDate.of(2024, 6, 15);

    @Test
    void keepsTransactionsInsideTwelveMonthWindow() {
        Transaction onBoundary = transaction(LocalDate.of(2023, 6, 15), "Subscriptions");
        Transaction tooOld = transaction(LocalDate.of(2023, 6, 14), "Subscriptions");
        Transaction recent = transaction(LocalDate.of(2024, 6, 1), "Subscriptions");

        List<Transaction> result = filter.filter(List.of(tooOld, recent, onBoundary), today);

        assertThat(result).containsExactly(recent, onBoundary);
    }

    @Test
    void dropsNonSpendCategories() {
        Transaction income = transaction(LocalDate.of(2024, 5, 1), "Income");
        Transaction gift = transaction(LocalDate.of(2024, 5, 2), " Gift Money ");
        Transaction excluded = transaction(LocalDate.of(2024, 5, 3), "Excluded");
        Transaction spend = transaction(LocalDate.of(2024, 5, 4), "Entertainment");

        assertThat(filter.filter(List.of(income, gift, excluded, spend), today)).containsExactly(spend);
    }

    @Test
    void dropsRowsWithoutDateAndKeepsMissingCategory() {
        Transaction undated = transaction(null, "Groceries");
        Transaction uncategorised = transaction(LocalDate.of(2024, 5, 4), null);

        assertThat(filter.filter(List.of(undated, uncategorised), today)).containsExactly(uncategorised);
    }

    @Test
    void emptyInputYieldsEmptyOutput() {
        assertThat(filter.filter(List.of(), today)).isEmpty();
    }

    private Transaction transaction(LocalDate date, String category) {
        return new Transaction(UUID.randomUUID(), date, category, "Netflix", null, new BigDecimal("-9.99"));
    }
}
