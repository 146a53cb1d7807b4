package com.analyticscache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Indexed Analytics Cache
 *
 * Serves practice/provider measure tables to many users from one shared Redis cache.
 *
 * Architecture:
 * - Secondary index sets over granular cache entries (one per measure/practice/provider/frequency)
 * - Warming orchestrator with distributed locks and a cooldown for automatic warms
 * - Background scheduler that refreshes stale data sources off the request path
 * - In-memory RBAC, date-range and advanced filtering after every fetch
 *
 * Freshness Targets:
 * - Data lands 1-2x daily, entries live 48 hours
 * - Proactive warm after 3 hours, served as stale after 4 hours
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
@EnableScheduling
public class AnalyticsCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsCacheApplication.class, args);
    }
}
