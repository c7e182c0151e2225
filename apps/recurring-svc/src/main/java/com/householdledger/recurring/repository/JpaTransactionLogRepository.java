package com.householdledger.recurring.repository;

import com.householdledger.recurring.entity.TransactionLogEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTransactionLogRepository extends JpaRepository<TransactionLogEntity, UUID> {

    @Query("SELECT t FROM TransactionLogEntity t WHERE t.date >= :from ORDER BY t.date ASC, t.id ASC")
    List<TransactionLogEntity> findFrom(@Param("from") LocalDate from);
}
