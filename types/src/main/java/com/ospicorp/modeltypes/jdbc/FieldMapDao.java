package com.ospicorp.modeltypes.jdbc;

import com.ospicorp.modeltypes.models.FieldMap;
import com.ospicorp.modeltypes.models.KeySubstitution;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class FieldMapDao {
  private static final Logger log = LoggerFactory.getLogger(FieldMapDao.class);

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final NamedParameterJdbcTemplate jdbc;
  private final FieldMapRowMapper rowMapper = new FieldMapRowMapper();

  public FieldMapDao(NamedParameterJdbcTemplate jdbc) { this.jdbc = jdbc; }

  /**
   * Inserts the values as one row. A zero primary key is left out so the database
   * assigns one; {@link SqlValuer} values are converted first.
   *
   * @return the number of inserted rows
   */
  public int insert(String table, FieldMap fields) {
    return insert(table, fields, List.of());
  }

  /**
   * Inserts the values after renaming field names to column names.
   */
  public int insert(String table, FieldMap fields, List<KeySubstitution> substitutions) {
    checkIdentifier(table);
    FieldMap row = new FieldMap(fields.asMap());
    row.substituteKeys(substitutions);
    row.removePkIfZero();
    if (row.isEmpty()) {
      throw new IllegalArgumentException("no column to insert into " + table);
    }

    List<String> columns = row.keys().stream().sorted().toList();
    MapSqlParameterSource params = new MapSqlParameterSource();
    for (String column : columns) {
      checkIdentifier(column);
      params.addValue(column, toSqlValue(row.get(column)));
    }
    String sql = "INSERT INTO " + table
        + " (" + String.join(", ", columns) + ")"
        + " VALUES (" + columns.stream().map(c -> ":" + c).collect(Collectors.joining(", ")) + ")";
    log.debug("Executing {}", sql);
    return jdbc.update(sql, params);
  }

  public Optional<FieldMap> findById(String table, long id) {
    checkIdentifier(table);
    String sql = "SELECT * FROM " + table + " WHERE id = :id";
    log.debug("Executing {} with id {}", sql, id);
    return jdbc.query(sql, new MapSqlParameterSource("id", id), rowMapper)
        .stream()
        .findFirst();
  }

  public List<FieldMap> findAll(String table) {
    checkIdentifier(table);
    String sql = "SELECT * FROM " + table + " ORDER BY id";
    log.debug("Executing {}", sql);
    return jdbc.query(sql, rowMapper);
  }

  static Object toSqlValue(Object value) {
    return value instanceof SqlValuer valuer ? valuer.toSqlValue() : value;
  }

  private static void checkIdentifier(String name) {
    if (name == null || !IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("invalid SQL identifier: " + name);
    }
  }
}
