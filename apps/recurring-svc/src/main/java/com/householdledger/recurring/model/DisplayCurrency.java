package com.householdledger.recurring.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;

/**
 * The two currencies the transaction log carries. FX rates are always expressed as
 * units of USD per 1 GBP.
 */
public enum DisplayCurrency {
    GBP,
    USD;

    public DisplayCurrency other() {
        return this == GBP ? USD : GBP;
    }

    /**
     * Converts a magnitude held in {@link #other()} into this currency.
     */
    public BigDecimal convertFromOther(BigDecimal amount, BigDecimal gbpUsdRate) {
        if (this == USD) {
            return amount.multiply(gbpUsdRate, MathContext.DECIMAL64);
        }
        return amount.divide(gbpUsdRate, MathContext.DECIMAL64);
    }

    public static DisplayCurrency parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("currency must be provided");
        }
        try {
            return DisplayCurrency.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported currency: " + code);
        }
    }
}
