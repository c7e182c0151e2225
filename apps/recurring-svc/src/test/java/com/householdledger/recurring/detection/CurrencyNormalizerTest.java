package com.householdledger.recurring.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CurrencyNormalizerTest {

    private static final BigDecimal RATE = new BigDecimal("1.25");

    @Test
    void prefersNativeAmountInTargetCurrency() {
        Transaction tx = transaction(new BigDecimal("-12.00"), new BigDecimal("-10.00"));

        assertThat(new CurrencyNormalizer(DisplayCurrency.USD, RATE).magnitude(tx))
                .hasValueSatisfying(amount -> assertThat(amount).isEqualByComparingTo("12.00"));
        assertThat(new CurrencyNormalizer(DisplayCurrency.GBP, RATE).magnitude(tx))
                .hasValueSatisfying(amount -> assertThat(amount).isEqualByComparingTo("10.00"));
    }

    @Test
    void convertsGbpToUsdByMultiplying() {
        Transaction tx = transaction(null, new BigDecimal("-10.00"));

        assertThat(new CurrencyNormalizer(DisplayCurrency.USD, RATE).magnitude(tx))
                .hasValueSatisfying(amount -> assertThat(amount).isEqualByComparingTo("12.50"));
    }

    @Test
    void convertsUsdToGbpByDividing() {
        Transaction tx = transaction(new BigDecimal("-25.00"), null);

        assertThat(new CurrencyNormalizer(DisplayCurrency.GBP, RATE).magnitude(tx))
                .hasValueSatisfying(amount -> assertThat(amount).isEqualByComparingTo("20.00"));
    }

    @Test
    void fallsBackToOtherLegWhenNativeAmountIsNotAnOutflow() {
        Transaction refundInGbp = transaction(new BigDecimal("-25.00"), new BigDecimal("5.00"));

        assertThat(new CurrencyNormalizer(DisplayCurrency.GBP, RATE).magnitude(refundInGbp))
                .hasValueSatisfying(amount -> assertThat(amount).isEqualByComparingTo("20.00"));
    }

    @Test
    void dropsTransactionsWithoutUsableOutflow() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(DisplayCurrency.GBP, RATE);
        Transaction inflow = transaction(new BigDecimal("30.00"), new BigDecimal("24.00"));
        Transaction empty = transaction(null, null);
        Transaction zero = transaction(BigDecimal.ZERO, BigDecimal.ZERO);
        Transaction usable = transaction(null, new BigDecimal("-4.50"));

        List<NormalizedTransaction> result = normalizer.normalize(List.of(inflow, empty, zero, usable));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).source()).isEqualTo(usable);
        assertThat(result.get(0).magnitude()).isEqualByComparingTo("4.50");
    }

    private Transaction transaction(BigDecimal usd, BigDecimal gbp) {
        return new Transaction(UUID.randomUUID(), LocalDate.of(2024, 3, 1), "Subscriptions", "Spotify", usd, gbp);
    }
}
