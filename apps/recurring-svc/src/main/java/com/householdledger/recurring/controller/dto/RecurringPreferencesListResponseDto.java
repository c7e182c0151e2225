package com.householdledger.recurring.controller.dto;

import java.util.List;

public record RecurringPreferencesListResponseDto(List<RecurringPreferenceResponseDto> preferences, String traceId) {
}
