package com.householdledger.recurring.detection;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

final class IntervalAnalyzer {

    /**
     * Day gaps between consecutive dates. Input must already be sorted ascending.
     */
    List<Integer> gaps(List<LocalDate> sortedDates) {
        if (sortedDates.size() < 2) {
            return List.of();
        }
        List<Integer> gaps = new ArrayList<>(sortedDates.size() - 1);
        for (int i = 1; i < sortedDates.size(); i++) {
            gaps.add(Math.toIntExact(ChronoUnit.DAYS.between(sortedDates.get(i - 1), sortedDates.get(i))));
        }
        return gaps;
    }

    static double mean(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).average().orElse(0d);
    }
}
