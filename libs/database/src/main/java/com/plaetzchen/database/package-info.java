/**
 * Database schema for the Plaetzchen community platform.
 *
 * <p>Flyway owns the schema. Migrations live in {@code src/main/resources/db/migration} using the
 * {@code V{n}__{desc}.sql} naming and are picked up from the classpath by Spring Boot's Flyway
 * auto-configuration in the service module. Hibernate never generates DDL.
 *
 * <p>The SQL is kept portable between PostgreSQL (production) and H2 in PostgreSQL mode (tests):
 * identity columns, {@code TIMESTAMP WITH TIME ZONE}, {@code VARCHAR} instead of {@code TEXT}.
 *
 * @see com.plaetzchen.database.migration.MigrationService
 */
package com.plaetzchen.database;
