package com.plaetzchen.database.migration;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of the Flyway migration state of the community database.
 *
 * <p>WHY: admins need to see which schema version a running instance is on without shell access
 * to the database. This wraps {@link Flyway#info()} and exposes the result as records that the
 * admin API returns as JSON.
 *
 * <p>This is a POJO (no Spring annotations) so it can be tested against an in-memory database
 * without a Spring context. The service module wires it up around Spring Boot's auto-configured
 * {@link Flyway} bean.
 */
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    /**
     * Status of a single migration.
     *
     * @param version migration version (e.g., "1"), null for repeatable migrations
     * @param description migration description (e.g., "initial schema")
     * @param state Flyway state (e.g., "Success", "Pending")
     * @param installedOn when the migration was applied, null if pending
     */
    public record MigrationInfo(
            String version, String description, String state, Instant installedOn) {}

    /**
     * Overall migration status of a database.
     *
     * @param database logical database name
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no migrations applied)
     * @param migrations every known migration, in version order
     */
    public record DatabaseStatus(
            String database,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion,
            List<MigrationInfo> migrations) {}

    private final Flyway flyway;
    private final String database;

    /**
     * @param flyway configured Flyway instance
     * @param database logical database name reported in the status
     */
    public MigrationService(Flyway flyway, String database) {
        if (flyway == null) {
            throw new IllegalArgumentException("flyway must not be null");
        }
        this.flyway = flyway;
        this.database = database;
    }

    /**
     * Reads the current migration status from the schema history table.
     */
    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        List<MigrationInfo> migrations =
                Arrays.stream(info.all()).map(MigrationService::toInfo).toList();
        org.flywaydb.core.api.MigrationInfo current = info.current();
        String currentVersion =
                current != null && current.getVersion() != null
                        ? current.getVersion().getVersion()
                        : null;
        var status =
                new DatabaseStatus(
                        database,
                        info.applied().length,
                        info.pending().length,
                        currentVersion,
                        migrations);
        log.debug(
                "Migration status for {}: version={}, applied={}, pending={}",
                database,
                currentVersion,
                status.appliedMigrations(),
                status.pendingMigrations());
        return status;
    }

    private static MigrationInfo toInfo(org.flywaydb.core.api.MigrationInfo migration) {
        return new MigrationInfo(
                migration.getVersion() != null ? migration.getVersion().getVersion() : null,
                migration.getDescription(),
                migration.getState().getDisplayName(),
                migration.getInstalledOn() != null ? migration.getInstalledOn().toInstant() : null);
    }
}
