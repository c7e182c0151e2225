package com.householdledger.recurring.detection;

import com.householdledger.recurring.model.DetectedRecurringPayment;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an accepted series into a display-ready detection.
 */
final class Projector {

    DetectedRecurringPayment project(CandidateSeries series, Classification.Accepted accepted) {
        LocalDate lastDate = series.lastDate();
        LocalDate nextExpected = lastDate.plusDays(Math.round(accepted.averageInterval()));
        return new DetectedRecurringPayment(
                series.patternKey(),
                displayName(series),
                accepted.frequency(),
                averageAmount(series.magnitudes()),
                nextExpected,
                series.size(),
                lastDate
        );
    }

    /**
     * Most frequent raw counterparty; ties go to the name seen first in date order.
     */
    static String displayName(CandidateSeries series) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (NormalizedTransaction transaction : series.transactions()) {
            counts.merge(transaction.counterparty(), 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    static BigDecimal averageAmount(List<BigDecimal> magnitudes) {
        BigDecimal total = magnitudes.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(magnitudes.size()), MathContext.DECIMAL64)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
