package com.procflow.backend.support;

import org.flywaydb.core.Flyway;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests.
 * The schema is rebuilt from the Flyway migrations once per JVM; tests isolate their data by tenant.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("procflow_test")
            .withUsername("procflow_user")
            .withPassword("procflow_password");

    private static final Object MIGRATION_LOCK = new Object();
    private static boolean initialized = false;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        synchronized (MIGRATION_LOCK) {
            if (!initialized) {
                POSTGRES.start();
                cleanAndMigrate();
                initialized = true;
            }
        }

        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("spring.flyway.url", POSTGRES::getJdbcUrl);
        registry.add("spring.flyway.user", POSTGRES::getUsername);
        registry.add("spring.flyway.password", POSTGRES::getPassword);
    }

    private static void cleanAndMigrate() {
        Flyway flyway = Flyway.configure()
                .dataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword())
                .locations("classpath:db/migration")
                .cleanDisabled(false)
                .load();
        flyway.clean();
        flyway.migrate();
    }
}
