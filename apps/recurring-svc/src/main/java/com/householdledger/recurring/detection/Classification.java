package com.householdledger.recurring.detection;

import com.householdledger.recurring.model.Frequency;

/**
 * Outcome of classifying one candidate series. Every outcome names the rule that produced it.
 */
public interface Classification {

    boolean isAccepted();

    record Accepted(Frequency frequency, double averageInterval, Rule rule) implements Classification {
        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    record Rejected(Reason reason) implements Classification {
        @Override
        public boolean isAccepted() {
            return false;
        }
    }

    enum Rule {
        MONTHLY,
        YEARLY,
        TWO_POINT_MONTHLY,
        RECENT_FALLBACK
    }

    enum Reason {
        INSUFFICIENT_DATA,
        LAPSED,
        AMOUNT_VARIANCE,
        NO_CADENCE
    }
}
