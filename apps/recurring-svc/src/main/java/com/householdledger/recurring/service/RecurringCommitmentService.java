package com.householdledger.recurring.service;

import com.householdledger.recurring.config.RecurringProperties;
import com.householdledger.recurring.entity.RecurringCommitmentEntity;
import com.householdledger.recurring.model.CommitmentRegister;
import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.model.RecurringCommitment;
import com.householdledger.recurring.repository.JpaRecurringCommitmentRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The hand-maintained register of recurring commitments, shown next to the detected ones.
 * Rows are merged by name, ranked by annualized spend, and the commitments making up the
 * top 80% of spend are marked.
 */
@Service
public class RecurringCommitmentService {

    private static final Logger log = LoggerFactory.getLogger(RecurringCommitmentService.class);

    static final BigDecimal TOP_SPEND_SHARE = new BigDecimal("0.80");

    private final JpaRecurringCommitmentRepository commitmentRepository;
    private final FxRateService fxRateService;
    private final RecurringProperties properties;

    public RecurringCommitmentService(
            JpaRecurringCommitmentRepository commitmentRepository,
            FxRateService fxRateService,
            RecurringProperties properties
    ) {
        this.commitmentRepository = commitmentRepository;
        this.fxRateService = fxRateService;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public CommitmentRegister getRegister(Optional<DisplayCurrency> currency) {
        DisplayCurrency target = currency.orElseGet(() -> properties.currency().displayCurrency());
        BigDecimal fxRate = fxRateService.currentRate();
        List<RecurringCommitmentEntity> rows = commitmentRepository.findAllByOrderByNameAsc();
        CommitmentRegister register = aggregate(rows, target, fxRate);
        log.debug("Commitment register in {}: {} rows merged into {} commitments, total {}",
                target, rows.size(), register.commitments().size(), register.totalAnnualized());
        return register;
    }

    /**
     * Flips the review flag on every row with this name. The merged commitment counts as
     * flagged when any of its rows is.
     */
    @Transactional
    public CommitmentReview toggleReview(String name) {
        String normalized = normalizeName(name);
        List<RecurringCommitmentEntity> rows = commitmentRepository.findByNormalizedName(normalized);
        if (rows.isEmpty()) {
            throw new NoSuchElementException("No recurring commitment named '" + name.trim() + "'");
        }
        boolean flagged = rows.stream().anyMatch(RecurringCommitmentEntity::isNeedsReview);
        rows.forEach(row -> row.setNeedsReview(!flagged));
        commitmentRepository.saveAll(rows);
        log.info("Commitment '{}' needsReview={} ({} rows)", normalized, !flagged, rows.size());
        return new CommitmentReview(rows.get(0).getName().trim(), !flagged, rows.size());
    }

    static CommitmentRegister aggregate(List<RecurringCommitmentEntity> rows, DisplayCurrency currency, BigDecimal fxRate) {
        Map<String, Merged> byName = new LinkedHashMap<>();
        for (RecurringCommitmentEntity row : rows) {
            String key = row.getName() == null ? "" : row.getName().trim().toLowerCase(Locale.ROOT);
            Merged merged = byName.computeIfAbsent(key, k -> new Merged(row.getName() == null ? "" : row.getName().trim()));
            merged.amount = merged.amount.add(amountIn(row, currency, fxRate));
            merged.needsReview |= row.isNeedsReview();
            merged.rowCount++;
        }

        List<Merged> ranked = new ArrayList<>(byName.values());
        // stable, so equal amounts keep name order
        ranked.sort(Comparator.comparing((Merged merged) -> merged.amount.abs()).reversed());

        BigDecimal total = ranked.stream()
                .map(merged -> merged.amount.abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal threshold = total.multiply(TOP_SPEND_SHARE);

        List<RecurringCommitment> commitments = new ArrayList<>(ranked.size());
        BigDecimal cumulative = BigDecimal.ZERO;
        for (Merged merged : ranked) {
            cumulative = cumulative.add(merged.amount.abs());
            commitments.add(new RecurringCommitment(
                    merged.name,
                    money(merged.amount),
                    money(cumulative),
                    cumulative.compareTo(threshold) <= 0,
                    merged.needsReview,
                    merged.rowCount
            ));
        }
        return new CommitmentRegister(currency, fxRate, money(total), commitments);
    }

    /**
     * The native amount when the sheet has one, else the other currency's amount converted.
     */
    static BigDecimal amountIn(RecurringCommitmentEntity row, DisplayCurrency currency, BigDecimal fxRate) {
        BigDecimal nativeAmount = currency == DisplayCurrency.USD ? row.getAnnualizedAmountUsd() : row.getAnnualizedAmountGbp();
        if (nativeAmount != null) {
            return nativeAmount;
        }
        BigDecimal otherAmount = currency == DisplayCurrency.USD ? row.getAnnualizedAmountGbp() : row.getAnnualizedAmountUsd();
        return otherAmount == null ? BigDecimal.ZERO : currency.convertFromOther(otherAmount, fxRate);
    }

    static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be provided");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static final class Merged {
        private final String name;
        private BigDecimal amount = BigDecimal.ZERO;
        private boolean needsReview;
        private int rowCount;

        private Merged(String name) {
            this.name = name;
        }
    }

    public record CommitmentReview(String name, boolean needsReview, int updatedRows) {
    }
}
