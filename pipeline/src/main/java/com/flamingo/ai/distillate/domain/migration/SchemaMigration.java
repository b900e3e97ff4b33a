package com.flamingo.ai.distillate.domain.migration;

import java.util.function.Consumer;
import java.util.function.Predicate;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One step of the item store's migration log.
 *
 * @param version position in the log, unique and increasing
 * @param description human-readable summary recorded with the version
 * @param needed existence check; false when the change is already present in the schema
 * @param apply the DDL/DML to run when {@code needed} holds
 */
public record SchemaMigration(
    int version,
    String description,
    Predicate<SchemaInspector> needed,
    Consumer<JdbcTemplate> apply) {}
