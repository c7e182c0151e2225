package com.householdledger.recurring.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Buckets transactions by the first five characters of the normalized counterparty.
 * Unrelated merchants sharing a prefix end up in one series; that is accepted.
 */
public final class PatternGrouper {

    static final int PATTERN_LENGTH = 5;

    public static String patternKey(String counterparty) {
        if (counterparty == null) {
            return "";
        }
        String normalized = counterparty.trim().toLowerCase(Locale.ROOT);
        return normalized.length() <= PATTERN_LENGTH ? normalized : normalized.substring(0, PATTERN_LENGTH);
    }

    List<CandidateSeries> group(List<NormalizedTransaction> transactions) {
        Map<String, List<NormalizedTransaction>> byPattern = new LinkedHashMap<>();
        for (NormalizedTransaction transaction : transactions) {
            if (!transaction.source().hasCounterparty()) {
                continue;
            }
            byPattern.computeIfAbsent(patternKey(transaction.counterparty()), key -> new ArrayList<>())
                    .add(transaction);
        }
        List<CandidateSeries> series = new ArrayList<>(byPattern.size());
        for (Map.Entry<String, List<NormalizedTransaction>> entry : byPattern.entrySet()) {
            List<NormalizedTransaction> members = entry.getValue();
            // List.sort is stable, so same-day rows keep feed order
            members.sort(Comparator.comparing(NormalizedTransaction::date));
            series.add(new CandidateSeries(entry.getKey(), members));
        }
        return series;
    }
}
