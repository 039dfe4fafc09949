package com.communitycare.reporting.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Value("${communitycare.flyway.repair-on-start:false}")
    private boolean repairOnStart;

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            if (repairOnStart) {
                repair(flyway);
            }
            flyway.migrate();
        };
    }

    private void repair(Flyway flyway) {
        try {
            log.info("[FLYWAY] Repairing schema history before migrate");
            flyway.repair();
        } catch (Exception ex) {
            // migrate() below reports the real problem if the history is still broken
            log.warn("[FLYWAY] Repair failed: {}", ex.getMessage());
        }
    }
}
