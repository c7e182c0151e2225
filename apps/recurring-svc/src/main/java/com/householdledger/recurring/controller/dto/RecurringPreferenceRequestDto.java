package com.householdledger.recurring.controller.dto;

import jakarta.validation.constraints.NotNull;

public record RecurringPreferenceRequestDto(@NotNull Boolean ignored) {
}
