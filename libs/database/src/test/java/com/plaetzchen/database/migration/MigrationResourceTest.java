package com.plaetzchen.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests that the SQL migrations are packaged where Flyway looks for them.
 *
 * <p>WHY: a migration missing from the jar only surfaces at deployment time, when Spring Boot
 * starts against an empty schema.
 */
@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    @Test
    @DisplayName("V1__initial_schema.sql creates every domain table")
    void initialSchemaCreatesTables() throws IOException {
        String sql = readClasspathResource("db/migration/V1__initial_schema.sql");

        assertThat(sql)
                .contains("CREATE TABLE users")
                .contains("CREATE TABLE refresh_tokens")
                .contains("CREATE TABLE events")
                .contains("CREATE TABLE event_participations")
                .contains("CREATE TABLE services")
                .contains("CREATE TABLE forum_threads")
                .contains("CREATE TABLE forum_posts")
                .contains("CREATE TABLE polls")
                .contains("CREATE TABLE poll_votes")
                .contains("CREATE TABLE comments")
                .contains("CREATE TABLE notifications");
    }

    @Test
    @DisplayName("one participation per member and event, one vote per member and poll")
    void uniquenessConstraints() throws IOException {
        String sql = readClasspathResource("db/migration/V1__initial_schema.sql");

        assertThat(sql).contains("UNIQUE (event_id, user_id)").contains("UNIQUE (user_id, poll_id)");
    }

    @Test
    @DisplayName("V2__seed_categories.sql seeds both category tables")
    void seedCategories() throws IOException {
        String sql = readClasspathResource("db/migration/V2__seed_categories.sql");

        assertThat(sql)
                .containsIgnoringCase("INSERT INTO event_categories")
                .containsIgnoringCase("INSERT INTO forum_categories");
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as(path + " must be on the classpath").isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
