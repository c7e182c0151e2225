package com.householdledger.recurring.config;

import com.householdledger.recurring.detection.DetectionPolicy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final RecurringProperties props;
    private final DetectionPolicy policy;

    public StartupDiagnostics(RecurringProperties props, DetectionPolicy policy) {
        this.props = props;
        this.policy = policy;
    }

    @PostConstruct
    void logConfig() {
        var currency = props.currency();
        log.info("Currency config: display='{}', defaultFxRate(USD per GBP)={}, env(RECURRING_DISPLAY_CURRENCY)='{}'",
                currency.displayCurrency(), currency.defaultFxRate(), System.getenv("RECURRING_DISPLAY_CURRENCY"));
        log.info("Detection policy: lookback={}m, liveness={}d, maxDeviation={}, monthly={}..{}d, yearly={}..{}d, share={}, density={} in {}m, fallback={}d",
                policy.lookbackMonths(), policy.livenessDays(), policy.maxAmountDeviation(),
                policy.monthlyMinGapDays(), policy.monthlyMaxGapDays(),
                policy.yearlyMinGapDays(), policy.yearlyMaxGapDays(),
                policy.minPatternShare(), policy.densityMinTransactions(), policy.densityWindowMonths(),
                policy.fallbackWindowDays());
        log.info("Excluded categories: {}", policy.excludedCategories());
    }
}
