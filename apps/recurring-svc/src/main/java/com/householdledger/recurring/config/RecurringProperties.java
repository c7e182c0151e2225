package com.householdledger.recurring.config;

import com.householdledger.recurring.detection.DetectionPolicy;
import com.householdledger.recurring.model.DisplayCurrency;
import java.math.BigDecimal;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "recurring")
public record RecurringProperties(
        Currency currency,
        Detection detection,
        Db db
) {

    @ConstructorBinding
    public RecurringProperties {
        if (currency == null) {
            throw new IllegalArgumentException("currency configuration must be provided");
        }
        // detection and db may be omitted; accessors fall back to defaults
    }

    public Detection detection() {
        return detection != null ? detection : Detection.empty();
    }

    public Db db() {
        return db != null ? db : new Db(null);
    }

    /**
     * @param display display currency used when a request does not name one
     * @param defaultFxRate USD per 1 GBP, used until a rate has been stored
     */
    public record Currency(String display, BigDecimal defaultFxRate) {
        public Currency {
            if (display == null || display.isBlank()) {
                throw new IllegalArgumentException("display currency must be provided");
            }
            DisplayCurrency.parse(display);
            if (defaultFxRate == null || defaultFxRate.signum() <= 0) {
                throw new IllegalArgumentException("defaultFxRate must be positive");
            }
        }

        public DisplayCurrency displayCurrency() {
            return DisplayCurrency.parse(display);
        }
    }

    /**
     * Overrides for {@link DetectionPolicy}. Any value left unset keeps the policy default.
     */
    public record Detection(
            Integer lookbackMonths,
            Integer livenessDays,
            BigDecimal maxAmountDeviation,
            Integer monthlyMinGapDays,
            Integer monthlyMaxGapDays,
            Integer yearlyMinGapDays,
            Integer yearlyMaxGapDays,
            Double minPatternShare,
            Integer monthlyMinTransactions,
            Integer monthlyMinGaps,
            Integer densityWindowMonths,
            Integer densityMinTransactions,
            Integer fallbackWindowDays,
            Set<String> excludedCategories
    ) {
        static Detection empty() {
            return new Detection(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
        }

        public DetectionPolicy toPolicy() {
            return new DetectionPolicy(
                    orDefault(lookbackMonths, DetectionPolicy.DEFAULT_LOOKBACK_MONTHS),
                    orDefault(livenessDays, DetectionPolicy.DEFAULT_LIVENESS_DAYS),
                    maxAmountDeviation != null ? maxAmountDeviation : DetectionPolicy.DEFAULT_MAX_AMOUNT_DEVIATION,
                    orDefault(monthlyMinGapDays, DetectionPolicy.DEFAULT_MONTHLY_MIN_GAP_DAYS),
                    orDefault(monthlyMaxGapDays, DetectionPolicy.DEFAULT_MONTHLY_MAX_GAP_DAYS),
                    orDefault(yearlyMinGapDays, DetectionPolicy.DEFAULT_YEARLY_MIN_GAP_DAYS),
                    orDefault(yearlyMaxGapDays, DetectionPolicy.DEFAULT_YEARLY_MAX_GAP_DAYS),
                    minPatternShare != null ? minPatternShare : DetectionPolicy.DEFAULT_MIN_PATTERN_SHARE,
                    orDefault(monthlyMinTransactions, DetectionPolicy.DEFAULT_MONTHLY_MIN_TRANSACTIONS),
                    orDefault(monthlyMinGaps, DetectionPolicy.DEFAULT_MONTHLY_MIN_GAPS),
                    orDefault(densityWindowMonths, DetectionPolicy.DEFAULT_DENSITY_WINDOW_MONTHS),
                    orDefault(densityMinTransactions, DetectionPolicy.DEFAULT_DENSITY_MIN_TRANSACTIONS),
                    orDefault(fallbackWindowDays, DetectionPolicy.DEFAULT_FALLBACK_WINDOW_DAYS),
                    excludedCategories != null ? excludedCategories : DetectionPolicy.DEFAULT_EXCLUDED_CATEGORIES
            );
        }

        private static int orDefault(Integer value, int fallback) {
            return value != null ? value : fallback;
        }
    }

    public record Db(Boolean bootstrapEnabled) {
        public boolean bootstrapEnabledFlag() {
            return bootstrapEnabled != null && bootstrapEnabled;
        }
    }
}
