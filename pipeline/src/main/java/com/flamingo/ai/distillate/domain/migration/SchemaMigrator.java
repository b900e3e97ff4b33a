package com.flamingo.ai.distillate.domain.migration;

import com.flamingo.ai.distillate.exception.SchemaMigrationException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies the item store's ordered migration log.
 *
 * <p>Each version is applied at most once and recorded in {@code schema_migrations}. A version is
 * also checked against the live schema before it runs, so databases created by older tooling are
 * adopted without re-running changes they already contain.
 */
@Component
@Slf4j
public class SchemaMigrator {

  static final String LOG_TABLE = "schema_migrations";

  private static final String CURRENT_MILLIS = "CAST(strftime('%s', 'now') AS INTEGER) * 1000";

  static final List<SchemaMigration> MIGRATIONS =
      List.of(
          new SchemaMigration(
              1,
              "create items table",
              schema -> !schema.tableExists("items"),
              jdbc ->
                  jdbc.execute(
                      """
                      CREATE TABLE items (
                          id TEXT PRIMARY KEY,
                          source TEXT NOT NULL,
                          title TEXT NOT NULL,
                          url TEXT NOT NULL,
                          raw_text TEXT,
                          summary TEXT,
                          category TEXT,
                          audio_path TEXT,
                          processed BOOLEAN NOT NULL DEFAULT 0
                      )
                      """)),
          new SchemaMigration(
              2,
              "add items.synthesized",
              schema -> !schema.columnExists("items", "synthesized"),
              jdbc -> {
                jdbc.execute(
                    "ALTER TABLE items ADD COLUMN synthesized BOOLEAN NOT NULL DEFAULT 0");
                // Existing history is treated as already reported
                jdbc.update("UPDATE items SET synthesized = 1 WHERE processed = 1");
              }),
          new SchemaMigration(
              3,
              "add items.ingested_at",
              schema -> !schema.columnExists("items", "ingested_at"),
              jdbc -> {
                jdbc.execute("ALTER TABLE items ADD COLUMN ingested_at TIMESTAMP");
                jdbc.update("UPDATE items SET ingested_at = " + CURRENT_MILLIS);
              }),
          new SchemaMigration(
              4,
              "add items.published_at",
              schema -> !schema.columnExists("items", "published_at"),
              jdbc -> {
                jdbc.execute("ALTER TABLE items ADD COLUMN published_at TIMESTAMP");
                jdbc.update("UPDATE items SET published_at = ingested_at WHERE published_at IS NULL");
              }),
          new SchemaMigration(
              5,
              "add items.insertion_sequence",
              schema -> !schema.columnExists("items", "insertion_sequence"),
              jdbc -> {
                jdbc.execute("ALTER TABLE items ADD COLUMN insertion_sequence INTEGER");
                jdbc.update(
                    "UPDATE items SET insertion_sequence = rowid WHERE insertion_sequence IS NULL");
              }),
          new SchemaMigration(
              6,
              "create reports table",
              schema -> !schema.tableExists("reports"),
              jdbc ->
                  jdbc.execute(
                      """
                      CREATE TABLE reports (
                          id INTEGER PRIMARY KEY AUTOINCREMENT,
                          generated_at TIMESTAMP NOT NULL,
                          whats_new TEXT,
                          feature_brief_summary TEXT,
                          key_takeaways TEXT,
                          audio_path TEXT
                      )
                      """)),
          new SchemaMigration(
              7,
              "rename legacy reports brief column to feature_brief_summary",
              schema ->
                  !schema.columnExists("reports", "feature_brief_summary")
                      && legacyBriefColumn(schema) != null,
              jdbc -> {
                String legacy = legacyBriefColumn(new SchemaInspector(jdbc));
                jdbc.execute(
                    "ALTER TABLE reports RENAME COLUMN " + legacy + " TO feature_brief_summary");
              }),
          new SchemaMigration(
              8,
              "create item lookup indexes",
              schema ->
                  !schema.indexExists("idx_items_state")
                      || !schema.indexExists("idx_items_source_sequence"),
              jdbc -> {
                jdbc.execute(
                    "CREATE INDEX IF NOT EXISTS idx_items_state ON items (processed, synthesized)");
                jdbc.execute(
                    "CREATE INDEX IF NOT EXISTS idx_items_source_sequence"
                        + " ON items (source, insertion_sequence)");
              }));

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final List<SchemaMigration> migrations;

  @Autowired
  public SchemaMigrator(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
    this(jdbcTemplate, transactionManager, MIGRATIONS);
  }

  SchemaMigrator(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      List<SchemaMigration> migrations) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.migrations = migrations;
  }

  /**
   * Brings the schema up to date.
   *
   * @return number of versions recorded by this call
   * @throws SchemaMigrationException if the store is unreachable or a migration fails
   */
  public int migrate() {
    Set<Integer> applied;
    try {
      jdbcTemplate.execute(
          "CREATE TABLE IF NOT EXISTS "
              + LOG_TABLE
              + " (version INTEGER PRIMARY KEY, description TEXT NOT NULL, applied_at TEXT NOT NULL)");
      applied =
          new HashSet<>(
              jdbcTemplate.queryForList("SELECT version FROM " + LOG_TABLE, Integer.class));
    } catch (DataAccessException e) {
      throw new SchemaMigrationException(0, "Item store is not reachable: " + e.getMessage(), e);
    }

    SchemaInspector inspector = new SchemaInspector(jdbcTemplate);
    int recorded = 0;
    for (SchemaMigration migration : migrations) {
      if (applied.contains(migration.version())) {
        continue;
      }
      apply(migration, inspector);
      recorded++;
    }

    if (recorded > 0) {
      log.info("Schema migrated: {} version(s) recorded", recorded);
    } else {
      log.debug("Schema up to date");
    }
    return recorded;
  }

  private void apply(SchemaMigration migration, SchemaInspector inspector) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            if (migration.needed().test(inspector)) {
              migration.apply().accept(jdbcTemplate);
              log.info("Applied migration {}: {}", migration.version(), migration.description());
            } else {
              log.info(
                  "Migration {} already present in schema, recording only: {}",
                  migration.version(),
                  migration.description());
            }
            jdbcTemplate.update(
                "INSERT INTO " + LOG_TABLE + " (version, description, applied_at) VALUES (?, ?, ?)",
                migration.version(),
                migration.description(),
                LocalDateTime.now(ZoneOffset.UTC).toString());
          });
    } catch (RuntimeException e) {
      throw new SchemaMigrationException(
          migration.version(),
          "Migration " + migration.version() + " (" + migration.description() + ") failed: "
              + e.getMessage(),
          e);
    }
  }

  private static String legacyBriefColumn(SchemaInspector schema) {
    for (String candidate : List.of("daily_brief_summary", "model_updates")) {
      if (schema.columnExists("reports", candidate)) {
        return candidate;
      }
    }
    return null;
  }
}
