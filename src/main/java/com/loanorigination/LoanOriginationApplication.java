package com.loanorigination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Loan origination core: rule engines, quality aggregation and the stage
 * workflow, with events published through a transactional outbox.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class LoanOriginationApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanOriginationApplication.class, args);
    }
}
