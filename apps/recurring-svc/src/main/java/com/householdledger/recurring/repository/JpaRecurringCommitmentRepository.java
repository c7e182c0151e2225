package com.householdledger.recurring.repository;

import com.householdledger.recurring.entity.RecurringCommitmentEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaRecurringCommitmentRepository extends JpaRepository<RecurringCommitmentEntity, UUID> {

    List<RecurringCommitmentEntity> findAllByOrderByNameAsc();

    /**
     * Rows whose trimmed, lowercased name equals {@code normalizedName}.
     */
    @Query("SELECT c FROM RecurringCommitmentEntity c WHERE lower(trim(c.name)) = :name ORDER BY c.name ASC")
    List<RecurringCommitmentEntity> findByNormalizedName(@Param("name") String normalizedName);
}
