package com.householdledger.recurring.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Detections after the ignore overlay, grouped by frequency. Within each group active
 * entries come first, ignored ones last.
 */
public record RecurringOverview(
        List<Entry> monthly,
        List<Entry> yearly
) {
    public RecurringOverview {
        monthly = List.copyOf(monthly);
        yearly = List.copyOf(yearly);
    }

    public List<Entry> all() {
        List<Entry> entries = new ArrayList<>(monthly.size() + yearly.size());
        entries.addAll(monthly);
        entries.addAll(yearly);
        return entries;
    }

    public List<Entry> active() {
        return all().stream().filter(entry -> !entry.ignored()).toList();
    }

    public List<Entry> ignored() {
        return all().stream().filter(Entry::ignored).toList();
    }

    public record Entry(DetectedRecurringPayment payment, boolean ignored) {
    }
}
