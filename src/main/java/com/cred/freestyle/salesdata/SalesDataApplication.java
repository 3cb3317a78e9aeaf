package com.cred.freestyle.salesdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the sales data generator.
 *
 * System Overview:
 * - Fabricates roughly two years of time-ordered order history for the appliance store
 * - Daily volume follows seasonal, trend and weekday demand curves
 * - Basket composition is drawn by popularity-weighted sampling
 * - Each order header, order item and stock decrement commits independently,
 *   so a bad record is skipped instead of aborting the run
 * - Product rating and yearly energy consumption are backfilled write-once
 *
 * Architecture:
 * - API Layer: admin REST endpoints guarded by header authentication
 * - Service Layer: generation orchestration and metric backfill
 * - Simulation Layer: demand curve and basket sampling (pure, no persistence)
 * - Data Access Layer: JPA repositories with conditional bulk updates
 * - Infrastructure Layer: Micrometer/CloudWatch metrics, scheduled backfill
 *
 * @author Sales Data Team
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class SalesDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesDataApplication.class, args);
    }
}
