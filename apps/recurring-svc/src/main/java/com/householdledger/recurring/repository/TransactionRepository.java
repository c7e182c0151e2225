package com.householdledger.recurring.repository;

import com.householdledger.recurring.model.Transaction;
import java.time.LocalDate;
import java.util.List;

public interface TransactionRepository {

    Transaction save(Transaction transaction);

    /**
     * Transactions dated on or after {@code fromInclusive}, oldest first.
     */
    List<Transaction> findFrom(LocalDate fromInclusive);
}
