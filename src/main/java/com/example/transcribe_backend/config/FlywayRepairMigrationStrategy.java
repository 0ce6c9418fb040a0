package com.example.transcribe_backend.config;

import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Repairs the schema history before migrating, so an edited migration does not block startup.
 */
@Configuration
public class FlywayRepairMigrationStrategy {

    /**
     * @return strategy that invokes {@link Flyway#repair()} prior to {@link Flyway#migrate()}.
     */
    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            flyway.repair();
            flyway.migrate();
        };
    }
}
