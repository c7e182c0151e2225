package com.householdledger.recurring.detection;

import com.householdledger.recurring.model.DetectedRecurringPayment;
import com.householdledger.recurring.model.Frequency;
import com.householdledger.recurring.model.RecurringOverview;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Applies the user's "not a recurring payment" flags. Ignored detections stay in the result,
 * flagged and ordered after the active ones of the same frequency, so they can be restored.
 */
@Component
public class PreferenceOverlay {

    public RecurringOverview apply(List<DetectedRecurringPayment> detections, Collection<String> ignoredPatternKeys) {
        Set<String> ignored = ignoredPatternKeys == null
                ? Set.of()
                : ignoredPatternKeys.stream()
                        .filter(key -> key != null)
                        .map(key -> key.trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
        List<DetectedRecurringPayment> ordered = new ArrayList<>(detections);
        ordered.sort(RecurringPaymentDetector.PRESENTATION_ORDER);
        return new RecurringOverview(
                partition(ordered, Frequency.MONTHLY, ignored),
                partition(ordered, Frequency.YEARLY, ignored)
        );
    }

    private static List<RecurringOverview.Entry> partition(
            List<DetectedRecurringPayment> ordered,
            Frequency frequency,
            Set<String> ignored
    ) {
        List<RecurringOverview.Entry> active = new ArrayList<>();
        List<RecurringOverview.Entry> ignoredEntries = new ArrayList<>();
        for (DetectedRecurringPayment payment : ordered) {
            if (payment.frequency() != frequency) {
                continue;
            }
            if (ignored.contains(payment.patternKey().toLowerCase(Locale.ROOT))) {
                ignoredEntries.add(new RecurringOverview.Entry(payment, true));
            } else {
                active.add(new RecurringOverview.Entry(payment, false));
            }
        }
        active.addAll(ignoredEntries);
        return active;
    }
}
