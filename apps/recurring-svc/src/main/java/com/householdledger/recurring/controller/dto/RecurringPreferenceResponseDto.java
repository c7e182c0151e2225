package com.householdledger.recurring.controller.dto;

import java.time.Instant;

public record RecurringPreferenceResponseDto(
        String patternKey,
        boolean ignored,
        Instant createdAt,
        Instant updatedAt
) {
}
