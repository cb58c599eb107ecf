package com.riskledger.register;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Register Service Application
 *
 * Risk, issue and opportunity registers:
 * - Level and rank classification from likelihood, consequence and impact scores
 * - Immutable version snapshots of every record and step change
 * - Field-level audit log with mandatory change rationale
 * - History and planned-vs-actual waterfall reconstruction
 */
@SpringBootApplication(scanBasePackages = {"com.riskledger.register", "com.riskledger.common"})
@EnableJpaRepositories
@EnableTransactionManagement
public class RegisterServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegisterServiceApplication.class, args);
    }
}
