package com.householdledger.recurring.detection;

import com.householdledger.recurring.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A transaction paired with its outflow magnitude in the display currency.
 */
record NormalizedTransaction(Transaction source, BigDecimal magnitude) {

    LocalDate date() {
        return source.date();
    }

    String counterparty() {
        return source.counterparty();
    }
}
