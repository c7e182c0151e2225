package com.householdledger.recurring.controller.dto;

public record CommitmentReviewResponseDto(String name, boolean needsReview, int updatedRows, String traceId) {
}
