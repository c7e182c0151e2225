package com.householdledger.recurring.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.householdledger.recurring.config.RecurringProperties;
import com.householdledger.recurring.detection.DetectionPolicy;
import com.householdledger.recurring.detection.PreferenceOverlay;
import com.householdledger.recurring.detection.RecurringPaymentDetector;
import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.model.RecurringOverview;
import com.householdledger.recurring.model.Transaction;
import com.householdledger.recurring.repository.InMemoryTransactionRepository;
import com.householdledger.recurring.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class RecurringPaymentServiceTest {

    @Mock
    private RecurringPreferenceService preferenceService;

    @Mock
    private FxRateService fxRateService;

    private TransactionRepository transactionRepository;

    private RecurringPaymentService recurringPaymentService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        transactionRepository = new InMemoryTransactionRepository();
        RecurringProperties properties = new RecurringProperties(
                new RecurringProperties.Currency("GBP", new BigDecimal("1.25")),
                null,
                null
        );
        Clock clock = Clock.fixed(Instant.parse("2024-03-20T09:00:00Z"), ZoneOffset.UTC);
        when(fxRateService.currentRate()).thenReturn(new BigDecimal("1.25"));
        when(preferenceService.ignoredPatterns()).thenReturn(Set.of());

        recurringPaymentService = new RecurringPaymentService(
                transactionRepository,
                preferenceService,
                fxRateService,
                new RecurringPaymentDetector(DetectionPolicy.defaults()),
                new PreferenceOverlay(),
                properties,
                clock
        );

        save("Netflix", "-15.99", LocalDate.of(2024, 1, 5));
        save("Netflix", "-15.99", LocalDate.of(2024, 2, 4));
        save("Netflix", "-15.99", LocalDate.of(2024, 3, 6));
        save("Corner Shop", "-3.20", LocalDate.of(2024, 3, 10));
    }

    @Test
    void usesConfiguredCurrencyAndClockByDefault() {
        var result = recurringPaymentService.getRecurringPayments(Optional.empty(), Optional.empty());

        assertThat(result.currency()).isEqualTo(DisplayCurrency.GBP);
        assertThat(result.asOf()).isEqualTo(LocalDate.of(2024, 3, 20));
        assertThat(result.fxRate()).isEqualByComparingTo("1.25");
        assertThat(result.overview().monthly()).singleElement().satisfies(entry -> {
            assertThat(entry.payment().patternKey()).isEqualTo("netfl");
            assertThat(entry.payment().averageAmount()).isEqualByComparingTo("15.99");
            assertThat(entry.ignored()).isFalse();
        });
        assertThat(result.overview().yearly()).isEmpty();
    }

    @Test
    void convertsToRequestedCurrency() {
        var result = recurringPaymentService.getRecurringPayments(Optional.of(DisplayCurrency.USD), Optional.empty());

        assertThat(result.currency()).isEqualTo(DisplayCurrency.USD);
        assertThat(result.overview().monthly()).singleElement()
                .satisfies(entry -> assertThat(entry.payment().averageAmount()).isEqualByComparingTo("19.99"));
    }

    @Test
    void flagsIgnoredPatterns() {
        when(preferenceService.ignoredPatterns()).thenReturn(Set.of("netfl"));

        RecurringOverview overview = recurringPaymentService.getRecurringPayments(Optional.empty(), Optional.empty()).overview();

        assertThat(overview.active()).isEmpty();
        assertThat(overview.ignored()).extracting(entry -> entry.payment().patternKey()).containsExactly("netfl");
        verify(preferenceService).ignoredPatterns();
    }

    @Test
    void asOfDateReplacesClock() {
        var result = recurringPaymentService.getRecurringPayments(Optional.empty(), Optional.of(LocalDate.of(2024, 8, 1)));

        // by August the subscription has lapsed
        assertThat(result.asOf()).isEqualTo(LocalDate.of(2024, 8, 1));
        assertThat(result.overview().all()).isEmpty();
    }

    private void save(String counterparty, String amountGbp, LocalDate date) {
        transactionRepository.save(new Transaction(UUID.randomUUID(), date, "Subscriptions", counterparty, null, new BigDecimal(amountGbp)));
    }
}
