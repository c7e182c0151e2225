package com.householdledger.recurring.controller;

import com.householdledger.recurring.controller.dto.RecurringPaymentsResponseDto;
import com.householdledger.recurring.controller.dto.RecurringPreferenceRequestDto;
import com.householdledger.recurring.controller.dto.RecurringPreferenceResponseDto;
import com.householdledger.recurring.controller.dto.RecurringPreferencesListResponseDto;
import com.householdledger.recurring.model.DetectedRecurringPayment;
import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.model.RecurringOverview;
import com.householdledger.recurring.model.RecurringPreference;
import com.householdledger.recurring.service.RecurringPaymentService;
import com.householdledger.recurring.service.RecurringPreferenceService;
import com.householdledger.recurring.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/recurring")
public class RecurringPaymentsController {

    private final RecurringPaymentService recurringPaymentService;
    private final RecurringPreferenceService preferenceService;

    public RecurringPaymentsController(
            RecurringPaymentService recurringPaymentService,
            RecurringPreferenceService preferenceService
    ) {
        this.recurringPaymentService = recurringPaymentService;
        this.preferenceService = preferenceService;
    }

    @GetMapping
    public ResponseEntity<RecurringPaymentsResponseDto> getRecurringPayments(
            @RequestParam(value = "currency", required = false) String currency,
            @RequestParam(value = "asOf", required = false) String asOf
    ) {
        Optional<DisplayCurrency> displayCurrency = Optional.ofNullable(currency)
                .filter(value -> !value.isBlank())
                .map(DisplayCurrency::parse);
        Optional<LocalDate> asOfDate = Optional.ofNullable(asOf)
                .filter(value -> !value.isBlank())
                .map(LocalDate::parse);
        var result = recurringPaymentService.getRecurringPayments(displayCurrency, asOfDate);
        RecurringOverview overview = result.overview();
        var response = new RecurringPaymentsResponseDto(
                result.currency().name(),
                result.fxRate(),
                result.asOf(),
                map(overview.monthly()),
                map(overview.yearly()),
                RequestContextHolder.traceId().orElse(null)
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/preferences")
    public ResponseEntity<RecurringPreferencesListResponseDto> listPreferences() {
        List<RecurringPreferenceResponseDto> preferences = preferenceService.listPreferences().stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new RecurringPreferencesListResponseDto(
                preferences,
                RequestContextHolder.traceId().orElse(null)
        ));
    }

    @PutMapping("/preferences/{patternKey}")
    public ResponseEntity<RecurringPreferenceResponseDto> setPreference(
            @PathVariable("patternKey") String patternKey,
            @RequestBody @Valid RecurringPreferenceRequestDto request
    ) {
        RecurringPreference updated = preferenceService.setIgnored(patternKey, request.ignored());
        return ResponseEntity.ok(map(updated));
    }

    @PostMapping("/preferences/{patternKey}/toggle")
    public ResponseEntity<RecurringPreferenceResponseDto> togglePreference(@PathVariable("patternKey") String patternKey) {
        return ResponseEntity.ok(map(preferenceService.toggle(patternKey)));
    }

    private List<RecurringPaymentsResponseDto.RecurringPaymentDto> map(List<RecurringOverview.Entry> entries) {
        return entries.stream()
                .map(entry -> {
                    DetectedRecurringPayment payment = entry.payment();
                    return new RecurringPaymentsResponseDto.RecurringPaymentDto(
                            payment.patternKey(),
                            payment.displayName(),
                            payment.frequency().label(),
                            payment.averageAmount(),
                            payment.nextExpectedDate(),
                            payment.transactionCount(),
                            payment.lastTransactionDate(),
                            entry.ignored()
                    );
                })
                .toList();
    }

    private RecurringPreferenceResponseDto map(RecurringPreference preference) {
        return new RecurringPreferenceResponseDto(
                preference.patternKey(),
                preference.ignored(),
                preference.createdAt(),
                preference.updatedAt()
        );
    }
}
