package com.householdledger.recurring.config;

import com.householdledger.recurring.detection.DetectionPolicy;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecurringConfig {

    @Bean
    public DetectionPolicy detectionPolicy(RecurringProperties properties) {
        return properties.detection().toPolicy();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
