package com.householdledger.recurring;

import com.householdledger.recurring.config.RecurringProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RecurringProperties.class)
public class RecurringServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecurringServiceApplication.class, args);
    }
}
