package com.householdledger.recurring.config;

import com.householdledger.recurring.detection.DetectionPolicy;
import com.householdledger.recurring.model.DisplayCurrency;
import java.math.BigDecimal;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecurringPropertiesTest {

    @Test
    void missingDetectionSectionFallsBackToDefaultPolicy() {
        RecurringProperties props = new RecurringProperties(
                new RecurringProperties.Currency("gbp", new BigDecimal("1.27")),
                null,
                null
        );

        assertEquals(DisplayCurrency.GBP, props.currency().displayCurrency());
        assertEquals(DetectionPolicy.defaults(), props.detection().toPolicy());
        assertFalse(props.db().bootstrapEnabledFlag());
    }

    @Test
    void detectionOverridesOnlyReplaceGivenValues() {
        RecurringProperties.Detection detection = new RecurringProperties.Detection(
                6, 45, null, null, null, null, null, null, null, null, null, null, null, Set.of("Transfers")
        );

        DetectionPolicy policy = detection.toPolicy();

        assertEquals(6, policy.lookbackMonths());
        assertEquals(45, policy.livenessDays());
        assertEquals(DetectionPolicy.DEFAULT_MONTHLY_MIN_GAP_DAYS, policy.monthlyMinGapDays());
        assertEquals(0, DetectionPolicy.DEFAULT_MAX_AMOUNT_DEVIATION.compareTo(policy.maxAmountDeviation()));
        assertEquals(Set.of("Transfers"), policy.excludedCategories());
    }

    @Test
    void invalidOverridesAreRejected() {
        RecurringProperties.Detection overlapping = new RecurringProperties.Detection(
                null, null, null, null, 40, 35, null, null, null, null, null, null, null, null
        );

        assertThrows(IllegalArgumentException.class, overlapping::toPolicy);
    }

    @Test
    void currencyMustBeSupportedAndRatePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new RecurringProperties.Currency("EUR", BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class,
                () -> new RecurringProperties.Currency("USD", BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RecurringProperties(null, null, null));
    }

    @Test
    void bootstrapFlagRespectsTrue() {
        assertTrue(new RecurringProperties.Db(true).bootstrapEnabledFlag());
        assertFalse(new RecurringProperties.Db(null).bootstrapEnabledFlag());
    }
}
