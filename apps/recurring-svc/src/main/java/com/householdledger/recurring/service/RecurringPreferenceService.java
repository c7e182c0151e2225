package com.householdledger.recurring.service;

import com.householdledger.recurring.detection.PatternGrouper;
import com.householdledger.recurring.entity.RecurringPreferenceEntity;
import com.householdledger.recurring.model.RecurringPreference;
import com.householdledger.recurring.repository.JpaRecurringPreferenceRepository;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class RecurringPreferenceService {

    private static final Logger log = LoggerFactory.getLogger(RecurringPreferenceService.class);

    private final JpaRecurringPreferenceRepository preferenceRepository;
    private final TransactionTemplate transactionTemplate;

    public RecurringPreferenceService(
            JpaRecurringPreferenceRepository preferenceRepository,
            PlatformTransactionManager transactionManager
    ) {
        this.preferenceRepository = preferenceRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Transactional(readOnly = true)
    public List<RecurringPreference> listPreferences() {
        return preferenceRepository.findAllByOrderByCounterpartyPatternAsc().stream()
                .map(RecurringPreferenceService::toModel)
                .toList();
    }

    @Transactional(readOnly = true)
    public Set<String> ignoredPatterns() {
        return preferenceRepository.findIgnoredPatterns().stream()
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Upserts the flag. When a concurrent request inserts the same key first, the unique
     * constraint rejects this insert and the write is retried as an update.
     */
    public RecurringPreference setIgnored(String patternKey, boolean ignored) {
        String normalized = normalizePattern(patternKey);
        RecurringPreferenceEntity saved;
        try {
            saved = transactionTemplate.execute(status -> upsert(normalized, ignored));
        } catch (DataIntegrityViolationException ex) {
            log.info("Recurring preference '{}' was created concurrently; retrying as update", normalized);
            saved = transactionTemplate.execute(status -> preferenceRepository.findByCounterpartyPattern(normalized)
                    .map(existing -> {
                        existing.setIgnored(ignored);
                        return preferenceRepository.saveAndFlush(existing);
                    })
                    .orElseThrow(() -> ex));
        }
        log.info("Recurring preference '{}' set to ignored={}", normalized, ignored);
        return toModel(saved);
    }

    /**
     * Flips the ignore flag. A pattern without a stored preference counts as not ignored.
     */
    public RecurringPreference toggle(String patternKey) {
        String normalized = normalizePattern(patternKey);
        boolean currentlyIgnored = preferenceRepository.findByCounterpartyPattern(normalized)
                .map(RecurringPreferenceEntity::isIgnored)
                .orElse(false);
        return setIgnored(normalized, !currentlyIgnored);
    }

    /**
     * Accepts either a stored pattern key or a raw counterparty name and reduces it to the
     * key the detector groups by.
     */
    static String normalizePattern(String patternKey) {
        if (patternKey == null || patternKey.isBlank()) {
            throw new IllegalArgumentException("patternKey must be provided");
        }
        return PatternGrouper.patternKey(patternKey);
    }

    private RecurringPreferenceEntity upsert(String normalized, boolean ignored) {
        RecurringPreferenceEntity entity = preferenceRepository.findByCounterpartyPattern(normalized)
                .orElseGet(() -> new RecurringPreferenceEntity(normalized, ignored));
        entity.setIgnored(ignored);
        return preferenceRepository.saveAndFlush(entity);
    }

    private static RecurringPreference toModel(RecurringPreferenceEntity entity) {
        return new RecurringPreference(
                entity.getId(),
                entity.getCounterpartyPattern(),
                entity.isIgnored(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
