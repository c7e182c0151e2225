package com.householdledger.recurring.detection;

import com.householdledger.recurring.model.DetectedRecurringPayment;
import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Detects subscriptions and annual commitments in a household transaction feed.
 *
 * <p>The pipeline is filter, currency normalization, prefix grouping, interval analysis,
 * rule-chain classification and projection. It holds no state between calls and performs
 * no I/O, so a single instance can serve concurrent requests. Series that cannot be
 * classified are left out of the result rather than reported as errors.
 */
@Component
public class RecurringPaymentDetector {

    private static final Logger log = LoggerFactory.getLogger(RecurringPaymentDetector.class);

    static final Comparator<DetectedRecurringPayment> PRESENTATION_ORDER = Comparator
            .comparing(DetectedRecurringPayment::frequency)
            .thenComparing(DetectedRecurringPayment::nextExpectedDate)
            .thenComparing(DetectedRecurringPayment::patternKey);

    private final DetectionPolicy policy;
    private final TransactionFilter transactionFilter;
    private final PatternGrouper patternGrouper;
    private final IntervalAnalyzer intervalAnalyzer;
    private final SeriesClassifier seriesClassifier;
    private final Projector projector;

    public RecurringPaymentDetector(DetectionPolicy policy) {
        this.policy = policy;
        this.transactionFilter = new TransactionFilter(policy);
        this.patternGrouper = new PatternGrouper();
        this.intervalAnalyzer = new IntervalAnalyzer();
        this.seriesClassifier = new SeriesClassifier(policy, intervalAnalyzer);
        this.projector = new Projector();
    }

    /**
     * @param fxRate units of USD per 1 GBP
     * @return detections ordered by frequency (monthly first), then next expected date
     */
    public List<DetectedRecurringPayment> detect(
            List<Transaction> transactions,
            DisplayCurrency currency,
            BigDecimal fxRate,
            LocalDate today
    ) {
        if (transactions == null) {
            throw new IllegalArgumentException("transactions must not be null");
        }
        if (currency == null) {
            throw new IllegalArgumentException("currency must be provided");
        }
        if (fxRate == null || fxRate.signum() <= 0) {
            throw new IllegalArgumentException("fxRate must be positive");
        }
        if (today == null) {
            throw new IllegalArgumentException("today must be provided");
        }

        List<Transaction> inWindow = transactionFilter.filter(transactions, today);
        List<NormalizedTransaction> usable = new CurrencyNormalizer(currency, fxRate).normalize(inWindow);
        List<CandidateSeries> candidates = patternGrouper.group(usable);

        List<DetectedRecurringPayment> detected = new ArrayList<>();
        for (CandidateSeries series : candidates) {
            if (series.size() < 2) {
                continue;
            }
            List<Integer> gaps = intervalAnalyzer.gaps(series.dates());
            Classification classification = seriesClassifier.classify(series, gaps, today);
            if (classification instanceof Classification.Accepted accepted) {
                log.debug("Series '{}' accepted as {} by rule {} (size={}, gaps={})",
                        series.patternKey(), accepted.frequency(), accepted.rule(), series.size(), gaps);
                detected.add(projector.project(series, accepted));
            } else if (classification instanceof Classification.Rejected rejected) {
                log.debug("Series '{}' rejected: {} (size={}, gaps={})",
                        series.patternKey(), rejected.reason(), series.size(), gaps);
            }
        }
        detected.sort(PRESENTATION_ORDER);
        log.info("Recurring detection as of {}: input={}, inWindow={}, usable={}, series={}, detected={}, currency={}",
                today, transactions.size(), inWindow.size(), usable.size(), candidates.size(), detected.size(), currency);
        return List.copyOf(detected);
    }

    public DetectionPolicy policy() {
        return policy;
    }
}
