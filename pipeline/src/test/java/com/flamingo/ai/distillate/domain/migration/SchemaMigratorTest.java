package com.flamingo.ai.distillate.domain.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.distillate.exception.SchemaMigrationException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.sqlite.SQLiteDataSource;

class SchemaMigratorTest {

  @TempDir Path tempDir;

  private JdbcTemplate jdbcTemplate;
  private DataSourceTransactionManager transactionManager;
  private SchemaInspector inspector;

  @BeforeEach
  void setUp() {
    SQLiteDataSource dataSource = new SQLiteDataSource();
    dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("test.db"));
    jdbcTemplate = new JdbcTemplate(dataSource);
    transactionManager = new DataSourceTransactionManager(dataSource);
    inspector = new SchemaInspector(jdbcTemplate);
  }

  @Test
  @DisplayName("should create the full schema on an empty database")
  void shouldCreateSchema_whenDatabaseEmpty() {
    int recorded = new SchemaMigrator(jdbcTemplate, transactionManager).migrate();

    assertThat(recorded).isEqualTo(SchemaMigrator.MIGRATIONS.size());
    assertThat(inspector.tableExists("items")).isTrue();
    assertThat(inspector.tableExists("reports")).isTrue();
    for (String column :
        List.of("synthesized", "ingested_at", "published_at", "insertion_sequence")) {
      assertThat(inspector.columnExists("items", column)).as(column).isTrue();
    }
    assertThat(inspector.columnExists("reports", "feature_brief_summary")).isTrue();
    assertThat(inspector.indexExists("idx_items_state")).isTrue();
    assertThat(inspector.indexExists("idx_items_source_sequence")).isTrue();
  }

  @Test
  @DisplayName("should record nothing when migrated twice")
  void shouldBeIdempotent_whenRunTwice() {
    SchemaMigrator migrator = new SchemaMigrator(jdbcTemplate, transactionManager);
    migrator.migrate();

    int second = migrator.migrate();

    assertThat(second).isZero();
    assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM schema_migrations", Integer.class))
        .isEqualTo(SchemaMigrator.MIGRATIONS.size());
  }

  @Test
  @DisplayName("should adopt a legacy items table and mark processed rows synthesized")
  void shouldUpgradeLegacyItems_whenColumnsMissing() {
    jdbcTemplate.execute(
        "CREATE TABLE items (id TEXT PRIMARY KEY, source TEXT NOT NULL, title TEXT NOT NULL,"
            + " url TEXT NOT NULL, raw_text TEXT, summary TEXT, category TEXT, audio_path TEXT,"
            + " processed BOOLEAN NOT NULL DEFAULT 0)");
    jdbcTemplate.update(
        "INSERT INTO items (id, source, title, url, processed) VALUES ('old', 'S', 'T', 'u', 1)");
    jdbcTemplate.update(
        "INSERT INTO items (id, source, title, url, processed) VALUES ('new', 'S', 'T', 'u', 0)");

    new SchemaMigrator(jdbcTemplate, transactionManager).migrate();

    List<Map<String, Object>> rows =
        jdbcTemplate.queryForList(
            "SELECT id, synthesized, insertion_sequence, published_at FROM items ORDER BY rowid");
    assertThat(rows).hasSize(2);
    assertThat(((Number) rows.get(0).get("synthesized")).intValue()).isEqualTo(1);
    assertThat(((Number) rows.get(1).get("synthesized")).intValue()).isZero();
    assertThat(((Number) rows.get(0).get("insertion_sequence")).longValue())
        .isLessThan(((Number) rows.get(1).get("insertion_sequence")).longValue());
    assertThat(rows).allSatisfy(row -> assertThat(row.get("published_at")).isNotNull());
  }

  @Test
  @DisplayName("should rename the legacy brief column of reports")
  void shouldRenameLegacyColumn_whenReportsTableOld() {
    jdbcTemplate.execute(
        "CREATE TABLE reports (id INTEGER PRIMARY KEY AUTOINCREMENT, generated_at TIMESTAMP,"
            + " whats_new TEXT, model_updates TEXT, key_takeaways TEXT, audio_path TEXT)");
    jdbcTemplate.update("INSERT INTO reports (generated_at, model_updates) VALUES (1, 'brief')");

    new SchemaMigrator(jdbcTemplate, transactionManager).migrate();

    assertThat(inspector.columnExists("reports", "model_updates")).isFalse();
    assertThat(
            jdbcTemplate.queryForObject("SELECT feature_brief_summary FROM reports", String.class))
        .isEqualTo("brief");
  }

  @Test
  @DisplayName("should report the failing version and keep earlier versions")
  void shouldThrowWithVersion_whenMigrationFails() {
    List<SchemaMigration> migrations =
        List.of(
            new SchemaMigration(
                1, "create t", schema -> !schema.tableExists("t"), jdbc -> jdbc.execute("CREATE TABLE t (x INTEGER)")),
            new SchemaMigration(
                2, "broken", schema -> true, jdbc -> jdbc.execute("ALTER TABLE missing ADD COLUMN y")));
    SchemaMigrator migrator = new SchemaMigrator(jdbcTemplate, transactionManager, migrations);

    assertThatThrownBy(migrator::migrate)
        .isInstanceOf(SchemaMigrationException.class)
        .satisfies(e -> assertThat(((SchemaMigrationException) e).getVersion()).isEqualTo(2));
    assertThat(jdbcTemplate.queryForList("SELECT version FROM schema_migrations", Integer.class))
        .containsExactly(1);
  }
}
