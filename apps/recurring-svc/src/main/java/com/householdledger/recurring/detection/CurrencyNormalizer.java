package com.householdledger.recurring.detection;

import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.model.Transaction;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves each outflow into the display currency. The native amount wins when it is an
 * outflow; otherwise the other leg is converted with the GBP/USD rate.
 */
final class CurrencyNormalizer {

    private final DisplayCurrency target;
    private final BigDecimal gbpUsdRate;

    CurrencyNormalizer(DisplayCurrency target, BigDecimal gbpUsdRate) {
        this.target = target;
        this.gbpUsdRate = gbpUsdRate;
    }

    Optional<BigDecimal> magnitude(Transaction transaction) {
        BigDecimal nativeAmount = transaction.amountIn(target);
        if (isOutflow(nativeAmount)) {
            return Optional.of(nativeAmount.abs());
        }
        BigDecimal otherAmount = transaction.amountIn(target.other());
        if (isOutflow(otherAmount)) {
            return Optional.of(target.convertFromOther(otherAmount.abs(), gbpUsdRate));
        }
        return Optional.empty();
    }

    /**
     * Transactions with no usable outflow in either currency are dropped here.
     */
    List<NormalizedTransaction> normalize(List<Transaction> transactions) {
        List<NormalizedTransaction> normalized = new ArrayList<>(transactions.size());
        for (Transaction transaction : transactions) {
            magnitude(transaction)
                    .filter(amount -> amount.signum() > 0)
                    .ifPresent(amount -> normalized.add(new NormalizedTransaction(transaction, amount)));
        }
        return normalized;
    }

    private static boolean isOutflow(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }
}
