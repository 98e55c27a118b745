package com.plaetzchen.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Runs the real migrations against an in-memory H2 database in PostgreSQL mode.
 *
 * <p>WHY: proves the SQL is valid for the database the service tests use, and that the status
 * reported to admins reflects the schema history table.
 */
@DisplayName("MigrationService")
class MigrationServiceTest {

    private Flyway flyway;
    private MigrationService service;

    @BeforeEach
    void setUp() {
        String url =
                "jdbc:h2:mem:migration-" + UUID.randomUUID()
                        + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
        flyway = Flyway.configure().dataSource(url, "sa", "").locations("classpath:db/migration").load();
        service = new MigrationService(flyway, "community");
    }

    @Test
    @DisplayName("reports every migration as pending before migrating")
    void pendingBeforeMigrate() {
        var status = service.status();

        assertThat(status.database()).isEqualTo("community");
        assertThat(status.appliedMigrations()).isZero();
        assertThat(status.pendingMigrations()).isEqualTo(2);
        assertThat(status.currentVersion()).isNull();
    }

    @Test
    @DisplayName("reports applied migrations and current version after migrating")
    void appliedAfterMigrate() {
        flyway.migrate();

        var status = service.status();

        assertThat(status.appliedMigrations()).isEqualTo(2);
        assertThat(status.pendingMigrations()).isZero();
        assertThat(status.currentVersion()).isEqualTo("2");
        assertThat(status.migrations())
                .extracting(MigrationService.MigrationInfo::description)
                .containsExactly("initial schema", "seed categories");
        assertThat(status.migrations()).allSatisfy(m -> assertThat(m.installedOn()).isNotNull());
    }

    @Test
    @DisplayName("rejects a null Flyway instance")
    void rejectsNullFlyway() {
        assertThatThrownBy(() -> new MigrationService(null, "community"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
