package com.householdledger.recurring.service;

import com.householdledger.recurring.config.RecurringProperties;
import com.householdledger.recurring.detection.PreferenceOverlay;
import com.householdledger.recurring.detection.RecurringPaymentDetector;
import com.householdledger.recurring.model.DetectedRecurringPayment;
import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.model.RecurringOverview;
import com.householdledger.recurring.model.Transaction;
import com.householdledger.recurring.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Fetches the inputs the detector needs (transaction snapshot, FX rate, ignore list), runs
 * detection and applies the ignore overlay.
 */
@Service
public class RecurringPaymentService {

    private static final Logger log = LoggerFactory.getLogger(RecurringPaymentService.class);

    private final TransactionRepository transactionRepository;
    private final RecurringPreferenceService preferenceService;
    private final FxRateService fxRateService;
    private final RecurringPaymentDetector detector;
    private final PreferenceOverlay preferenceOverlay;
    private final RecurringProperties properties;
    private final Clock clock;

    public RecurringPaymentService(
            TransactionRepository transactionRepository,
            RecurringPreferenceService preferenceService,
            FxRateService fxRateService,
            RecurringPaymentDetector detector,
            PreferenceOverlay preferenceOverlay,
            RecurringProperties properties,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.preferenceService = preferenceService;
        this.fxRateService = fxRateService;
        this.detector = detector;
        this.preferenceOverlay = preferenceOverlay;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public RecurringPaymentsResult getRecurringPayments(Optional<DisplayCurrency> currency, Optional<LocalDate> asOf) {
        DisplayCurrency target = currency.orElseGet(() -> properties.currency().displayCurrency());
        LocalDate today = asOf.orElseGet(() -> LocalDate.now(clock));
        BigDecimal fxRate = fxRateService.currentRate();

        LocalDate snapshotStart = today.minusMonths(detector.policy().lookbackMonths());
        List<Transaction> snapshot = transactionRepository.findFrom(snapshotStart);
        Set<String> ignoredPatterns = preferenceService.ignoredPatterns();
        log.debug("Loaded {} transactions since {} and {} ignored patterns", snapshot.size(), snapshotStart, ignoredPatterns.size());

        List<DetectedRecurringPayment> detected = detector.detect(snapshot, target, fxRate, today);
        RecurringOverview overview = preferenceOverlay.apply(detected, ignoredPatterns);
        log.debug("Recurring overview as of {} in {}: {} active, {} ignored",
                today, target, overview.active().size(), overview.ignored().size());
        return new RecurringPaymentsResult(target, fxRate, today, overview);
    }

    public record RecurringPaymentsResult(
            DisplayCurrency currency,
            BigDecimal fxRate,
            LocalDate asOf,
            RecurringOverview overview
    ) {
    }
}
