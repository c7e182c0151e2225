package com.householdledger.recurring.repository;

import com.householdledger.recurring.entity.RecurringPreferenceEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaRecurringPreferenceRepository extends JpaRepository<RecurringPreferenceEntity, UUID> {

    Optional<RecurringPreferenceEntity> findByCounterpartyPattern(String counterpartyPattern);

    List<RecurringPreferenceEntity> findAllByOrderByCounterpartyPatternAsc();

    @Query("SELECT p.counterpartyPattern FROM RecurringPreferenceEntity p WHERE p.ignored = true")
    List<String> findIgnoredPatterns();
}
