package com.householdledger.recurring.repository;

import com.householdledger.recurring.entity.FxRateEntity;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaFxRateRepository extends JpaRepository<FxRateEntity, UUID> {

    Optional<FxRateEntity> findFirstByOrderByDateDesc();
}
