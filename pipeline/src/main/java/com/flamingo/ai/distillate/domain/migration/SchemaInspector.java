package com.flamingo.ai.distillate.domain.migration;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

/** Reads SQLite catalog information for migration existence checks. */
@RequiredArgsConstructor
public class SchemaInspector {

  private final JdbcTemplate jdbcTemplate;

  public boolean tableExists(String table) {
    return countCatalogEntries("table", table) > 0;
  }

  public boolean indexExists(String index) {
    return countCatalogEntries("index", index) > 0;
  }

  public boolean columnExists(String table, String column) {
    if (!tableExists(table)) {
      return false;
    }
    // PRAGMA arguments cannot be bound; table names come from the migration log only
    List<Map<String, Object>> columns = jdbcTemplate.queryForList("PRAGMA table_info(" + table + ")");
    return columns.stream().anyMatch(row -> column.equalsIgnoreCase(String.valueOf(row.get("name"))));
  }

  private int countCatalogEntries(String type, String name) {
    Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sqlite_master WHERE type = ? AND name = ?",
            Integer.class,
            type,
            name);
    return count != null ? count : 0;
  }
}
