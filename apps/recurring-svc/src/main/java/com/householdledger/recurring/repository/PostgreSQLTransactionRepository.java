package com.householdledger.recurring.repository;

import com.householdledger.recurring.entity.TransactionLogEntity;
import com.householdledger.recurring.model.Transaction;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLTransactionRepository implements TransactionRepository {

    private final JpaTransactionLogRepository jpaTransactionLogRepository;

    public PostgreSQLTransactionRepository(JpaTransactionLogRepository jpaTransactionLogRepository) {
        this.jpaTransactionLogRepository = jpaTransactionLogRepository;
    }

    @Override
    public Transaction save(Transaction transaction) {
        TransactionLogEntity saved = jpaTransactionLogRepository.save(toEntity(transaction));
        return toModel(saved);
    }

    @Override
    public List<Transaction> findFrom(LocalDate fromInclusive) {
        return jpaTransactionLogRepository.findFrom(fromInclusive).stream()
                .map(this::toModel)
                .toList();
    }

    private TransactionLogEntity toEntity(Transaction transaction) {
        UUID id = transaction.id() != null ? transaction.id() : UUID.randomUUID();
        return new TransactionLogEntity(
                id,
                transaction.date(),
                transaction.category(),
                transaction.counterparty(),
                transaction.amountUsd(),
                transaction.amountGbp(),
                Instant.now()
        );
    }

    private Transaction toModel(TransactionLogEntity entity) {
        return new Transaction(
                entity.getId(),
                entity.getDate(),
                entity.getCategory(),
                entity.getCounterparty(),
                entity.getAmountUsd(),
                entity.getAmountGbp()
        );
    }
}
