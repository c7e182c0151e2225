package com.householdledger.recurring.detection;

import java.math.BigDecimal;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thresholds used by the recurring payment heuristic. The defaults are product policy;
 * changing one changes which payments users see as recurring.
 */
public record DetectionPolicy(
        int lookbackMonths,
        int livenessDays,
        BigDecimal maxAmountDeviation,
        int monthlyMinGapDays,
        int monthlyMaxGapDays,
        int yearlyMinGapDays,
        int yearlyMaxGapDays,
        double minPatternShare,
        int monthlyMinTransactions,
        int monthlyMinGaps,
        int densityWindowMonths,
        int densityMinTransactions,
        int fallbackWindowDays,
        Set<String> excludedCategories
) {

    public static final int DEFAULT_LOOKBACK_MONTHS = 12;
    public static final int DEFAULT_LIVENESS_DAYS = 60;
    public static final BigDecimal DEFAULT_MAX_AMOUNT_DEVIATION = new BigDecimal("0.10");
    public static final int DEFAULT_MONTHLY_MIN_GAP_DAYS = 25;
    public static final int DEFAULT_MONTHLY_MAX_GAP_DAYS = 37;
    public static final int DEFAULT_YEARLY_MIN_GAP_DAYS = 330;
    public static final int DEFAULT_YEARLY_MAX_GAP_DAYS = 400;
    public static final double DEFAULT_MIN_PATTERN_SHARE = 0.5d;
    public static final int DEFAULT_MONTHLY_MIN_TRANSACTIONS = 3;
    public static final int DEFAULT_MONTHLY_MIN_GAPS = 2;
    public static final int DEFAULT_DENSITY_WINDOW_MONTHS = 4;
    public static final int DEFAULT_DENSITY_MIN_TRANSACTIONS = 2;
    public static final int DEFAULT_FALLBACK_WINDOW_DAYS = 90;
    public static final Set<String> DEFAULT_EXCLUDED_CATEGORIES = Set.of(
            "Excluded", "Income", "Gift Money", "Other Income"
    );

    public DetectionPolicy {
        requirePositive(lookbackMonths, "lookbackMonths");
        requirePositive(livenessDays, "livenessDays");
        requirePositive(densityWindowMonths, "densityWindowMonths");
        requirePositive(fallbackWindowDays, "fallbackWindowDays");
        requirePositive(densityMinTransactions, "densityMinTransactions");
        if (maxAmountDeviation == null || maxAmountDeviation.signum() < 0) {
            throw new IllegalArgumentException("maxAmountDeviation must be zero or positive");
        }
        if (monthlyMinGapDays <= 0 || monthlyMaxGapDays < monthlyMinGapDays) {
            throw new IllegalArgumentException("monthly gap range is invalid: " + monthlyMinGapDays + ".." + monthlyMaxGapDays);
        }
        if (yearlyMinGapDays <= monthlyMaxGapDays || yearlyMaxGapDays < yearlyMinGapDays) {
            throw new IllegalArgumentException("yearly gap range is invalid: " + yearlyMinGapDays + ".." + yearlyMaxGapDays);
        }
        if (minPatternShare <= 0d || minPatternShare > 1d) {
            throw new IllegalArgumentException("minPatternShare must be in (0, 1]");
        }
        if (monthlyMinTransactions < 2) {
            throw new IllegalArgumentException("monthlyMinTransactions must be at least 2");
        }
        requirePositive(monthlyMinGaps, "monthlyMinGaps");
        excludedCategories = excludedCategories == null
                ? Set.of()
                : excludedCategories.stream()
                        .filter(category -> category != null && !category.isBlank())
                        .map(String::trim)
                        .collect(Collectors.toUnmodifiableSet());
    }

    public static DetectionPolicy defaults() {
        return new DetectionPolicy(
                DEFAULT_LOOKBACK_MONTHS,
                DEFAULT_LIVENESS_DAYS,
                DEFAULT_MAX_AMOUNT_DEVIATION,
                DEFAULT_MONTHLY_MIN_GAP_DAYS,
                DEFAULT_MONTHLY_MAX_GAP_DAYS,
                DEFAULT_YEARLY_MIN_GAP_DAYS,
                DEFAULT_YEARLY_MAX_GAP_DAYS,
                DEFAULT_MIN_PATTERN_SHARE,
                DEFAULT_MONTHLY_MIN_TRANSACTIONS,
                DEFAULT_MONTHLY_MIN_GAPS,
                DEFAULT_DENSITY_WINDOW_MONTHS,
                DEFAULT_DENSITY_MIN_TRANSACTIONS,
                DEFAULT_FALLBACK_WINDOW_DAYS,
                DEFAULT_EXCLUDED_CATEGORIES
        );
    }

    public boolean isMonthlyGap(int days) {
        return days >= monthlyMinGapDays && days <= monthlyMaxGapDays;
    }

    public boolean isMonthlyInterval(double days) {
        return days >= monthlyMinGapDays && days <= monthlyMaxGapDays;
    }

    public boolean isYearlyGap(int days) {
        return days >= yearlyMinGapDays && days <= yearlyMaxGapDays;
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
