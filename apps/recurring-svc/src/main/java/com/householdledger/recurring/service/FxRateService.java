package com.householdledger.recurring.service;

import com.householdledger.recurring.config.RecurringProperties;
import com.householdledger.recurring.entity.FxRateEntity;
import com.householdledger.recurring.repository.JpaFxRateRepository;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Supplies the GBP/USD rate (USD per 1 GBP) used for display conversion.
 */
@Service
public class FxRateService {

    private static final Logger log = LoggerFactory.getLogger(FxRateService.class);

    private final JpaFxRateRepository fxRateRepository;
    private final RecurringProperties properties;

    public FxRateService(JpaFxRateRepository fxRateRepository, RecurringProperties properties) {
        this.fxRateRepository = fxRateRepository;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public BigDecimal currentRate() {
        return fxRateRepository.findFirstByOrderByDateDesc()
                .map(FxRateEntity::getGbpUsdRate)
                .filter(rate -> rate != null && rate.signum() > 0)
                .orElseGet(() -> {
                    BigDecimal fallback = properties.currency().defaultFxRate();
                    log.debug("No stored FX rate; using configured default {}", fallback);
                    return fallback;
                });
    }
}
