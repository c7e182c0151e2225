package com.householdledger.recurring.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.householdledger.recurring.config.RecurringProperties;
import com.householdledger.recurring.entity.FxRateEntity;
import com.householdledger.recurring.repository.JpaFxRateRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class FxRateServiceTest {

    @Mock
    private JpaFxRateRepository fxRateRepository;

    private FxRateService fxRateService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        RecurringProperties properties = new RecurringProperties(
                new RecurringProperties.Currency("GBP", new BigDecimal("1.25")),
                null,
                null
        );
        fxRateService = new FxRateService(fxRateRepository, properties);
    }

    @Test
    void prefersLatestStoredRate() {
        when(fxRateRepository.findFirstByOrderByDateDesc())
                .thenReturn(Optional.of(new FxRateEntity(UUID.randomUUID(), LocalDate.of(2024, 3, 19), new BigDecimal("1.2710"))));

        assertThat(fxRateService.currentRate()).isEqualByComparingTo("1.2710");
    }

    @Test
    void fallsBackToConfiguredRate() {
        when(fxRateRepository.findFirstByOrderByDateDesc()).thenReturn(Optional.empty());

        assertThat(fxRateService.currentRate()).isEqualByComparingTo("1.25");
    }

    @Test
    void ignoresNonPositiveStoredRate() {
        when(fxRateRepository.findFirstByOrderByDateDesc())
                .thenReturn(Optional.of(new FxRateEntity(UUID.randomUUID(), LocalDate.of(2024, 3, 19), BigDecimal.ZERO)));

        assertThat(fxRateService.currentRate()).isEqualByComparingTo("1.25");
    }
}
