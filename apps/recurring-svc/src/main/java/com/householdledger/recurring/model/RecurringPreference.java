package com.householdledger.recurring.model;

import java.time.Instant;
import java.util.UUID;

public record RecurringPreference(
        UUID id,
        String patternKey,
        boolean ignored,
        Instant createdAt,
        Instant updatedAt
) {
}
