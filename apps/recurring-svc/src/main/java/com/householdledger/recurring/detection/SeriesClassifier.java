package com.householdledger.recurring.detection;

import com.householdledger.recurring.detection.Classification.Accepted;
import com.householdledger.recurring.detection.Classification.Reason;
import com.householdledger.recurring.detection.Classification.Rejected;
import com.householdledger.recurring.detection.Classification.Rule;
import com.householdledger.recurring.model.Frequency;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Ordered rule chain: two hard gates (liveness, amount variance) followed by four accepting
 * rules tried in turn. The first rule that accepts wins; if none does the series is rejected.
 */
final class SeriesClassifier {

    private final DetectionPolicy policy;
    private final IntervalAnalyzer intervalAnalyzer;

    SeriesClassifier(DetectionPolicy policy, IntervalAnalyzer intervalAnalyzer) {
        this.policy = policy;
        this.intervalAnalyzer = intervalAnalyzer;
    }

    Classification classify(CandidateSeries series, List<Integer> gaps, LocalDate today) {
        if (series.size() < 2) {
            return new Rejected(Reason.INSUFFICIENT_DATA);
        }
        if (series.lastDate().isBefore(today.minusDays(policy.livenessDays()))) {
            return new Rejected(Reason.LAPSED);
        }
        if (!amountsWithinTolerance(series.magnitudes())) {
            return new Rejected(Reason.AMOUNT_VARIANCE);
        }
        boolean dense = isDense(series, today);
        Optional<Accepted> accepted = monthly(series, gaps, dense)
                .or(() -> yearly(series, gaps))
                .or(() -> twoPointMonthly(series, gaps, dense))
                .or(() -> recentFallback(series, today));
        if (accepted.isPresent()) {
            return accepted.get();
        }
        return new Rejected(Reason.NO_CADENCE);
    }

    boolean amountsWithinTolerance(List<BigDecimal> magnitudes) {
        if (magnitudes.isEmpty()) {
            return false;
        }
        BigDecimal total = magnitudes.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = total.divide(BigDecimal.valueOf(magnitudes.size()), MathContext.DECIMAL64);
        if (average.signum() == 0) {
            return false;
        }
        for (BigDecimal magnitude : magnitudes) {
            BigDecimal deviation = magnitude.subtract(average).abs().divide(average, MathContext.DECIMAL64);
            if (deviation.compareTo(policy.maxAmountDeviation()) > 0) {
                return false;
            }
        }
        return true;
    }

    boolean isDense(CandidateSeries series, LocalDate today) {
        LocalDate densityStart = today.minusMonths(policy.densityWindowMonths());
        long recent = series.dates().stream().filter(date -> !date.isBefore(densityStart)).count();
        return recent >= policy.densityMinTransactions();
    }

    private Optional<Accepted> monthly(CandidateSeries series, List<Integer> gaps, boolean dense) {
        List<Integer> monthlyGaps = gaps.stream().filter(policy::isMonthlyGap).toList();
        if (series.size() < policy.monthlyMinTransactions()
                || monthlyGaps.size() < policy.monthlyMinGaps()
                || !holdsShare(monthlyGaps, gaps)
                || !dense) {
            return Optional.empty();
        }
        return Optional.of(new Accepted(Frequency.MONTHLY, IntervalAnalyzer.mean(monthlyGaps), Rule.MONTHLY));
    }

    private Optional<Accepted> yearly(CandidateSeries series, List<Integer> gaps) {
        List<Integer> yearlyGaps = gaps.stream().filter(policy::isYearlyGap).toList();
        if (series.size() < 2 || yearlyGaps.isEmpty() || !holdsShare(yearlyGaps, gaps)) {
            return Optional.empty();
        }
        return Optional.of(new Accepted(Frequency.YEARLY, IntervalAnalyzer.mean(yearlyGaps), Rule.YEARLY));
    }

    private Optional<Accepted> twoPointMonthly(CandidateSeries series, List<Integer> gaps, boolean dense) {
        if (series.size() != 2 || gaps.size() != 1 || !policy.isMonthlyGap(gaps.get(0)) || !dense) {
            return Optional.empty();
        }
        return Optional.of(new Accepted(Frequency.MONTHLY, gaps.get(0), Rule.TWO_POINT_MONTHLY));
    }

    private Optional<Accepted> recentFallback(CandidateSeries series, LocalDate today) {
        LocalDate fallbackStart = today.minusDays(policy.fallbackWindowDays());
        List<LocalDate> recentDates = series.dates().stream()
                .filter(date -> !date.isBefore(fallbackStart))
                .toList();
        if (recentDates.size() < 2) {
            return Optional.empty();
        }
        List<Integer> recentGaps = intervalAnalyzer.gaps(recentDates);
        boolean hasMonthlyGap = recentGaps.stream().anyMatch(policy::isMonthlyGap);
        double recentAverage = IntervalAnalyzer.mean(recentGaps);
        if (!hasMonthlyGap || !policy.isMonthlyInterval(recentAverage)) {
            return Optional.empty();
        }
        return Optional.of(new Accepted(Frequency.MONTHLY, recentAverage, Rule.RECENT_FALLBACK));
    }

    private boolean holdsShare(List<Integer> matching, List<Integer> all) {
        return matching.size() >= all.size() * policy.minPatternShare();
    }
}
