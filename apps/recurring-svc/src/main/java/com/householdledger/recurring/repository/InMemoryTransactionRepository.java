package com.householdledger.recurring.repository;

import com.householdledger.recurring.model.Transaction;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTransactionRepository implements TransactionRepository {

    private final Map<UUID, Transaction> storage = new ConcurrentHashMap<>();

    @Override
    public Transaction save(Transaction transaction) {
        Transaction stored = transaction.id() != null
                ? transaction
                : new Transaction(UUID.randomUUID(), transaction.date(), transaction.category(),
                        transaction.counterparty(), transaction.amountUsd(), transaction.amountGbp());
        storage.put(stored.id(), stored);
        return stored;
    }

    @Override
    public List<Transaction> findFrom(LocalDate fromInclusive) {
        return storage.values().stream()
                .filter(tx -> tx.date() != null && !tx.date().isBefore(fromInclusive))
                .sorted(Comparator.comparing(Transaction::date).thenComparing(Transaction::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
