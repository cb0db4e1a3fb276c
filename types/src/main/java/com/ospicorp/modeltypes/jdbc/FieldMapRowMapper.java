package com.ospicorp.modeltypes.jdbc;

import com.ospicorp.modeltypes.dates.Date;
import com.ospicorp.modeltypes.dates.DateTime;
import com.ospicorp.modeltypes.models.FieldMap;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Locale;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.lang.NonNull;

/**
 * Maps a row to a {@link FieldMap} keyed by column label. {@code DATE} columns
 * become {@link Date} and timestamp columns {@link DateTime}; SQL {@code NULL} in
 * those columns reads as the zero value. Other columns keep the driver's value.
 */
public class FieldMapRowMapper implements RowMapper<FieldMap> {

  @Override
  public FieldMap mapRow(@NonNull ResultSet rs, int rowNum) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    FieldMap row = new FieldMap();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      row.put(JdbcUtils.lookupColumnName(meta, i), readColumn(rs, meta, i));
    }
    return row;
  }

  private Object readColumn(ResultSet rs, ResultSetMetaData meta, int index) throws SQLException {
    switch (meta.getColumnType(index)) {
      case Types.DATE -> {
        LocalDate value = rs.getObject(index, LocalDate.class);
        return value == null ? Date.ZERO : Date.scan(value);
      }
      case Types.TIMESTAMP_WITH_TIMEZONE -> {
        return scanOffsetTimestamp(rs, index);
      }
      case Types.TIMESTAMP -> {
        // PostgreSQL reports timestamptz as TIMESTAMP
        if (hasTimeZone(meta.getColumnTypeName(index))) {
          return scanOffsetTimestamp(rs, index);
        }
        LocalDateTime value = rs.getObject(index, LocalDateTime.class);
        return value == null ? DateTime.ZERO : DateTime.scan(value);
      }
      default -> {
        return JdbcUtils.getResultSetValue(rs, index);
      }
    }
  }

  private DateTime scanOffsetTimestamp(ResultSet rs, int index) throws SQLException {
    OffsetDateTime value = rs.getObject(index, OffsetDateTime.class);
    return value == null ? DateTime.ZERO : DateTime.scan(value);
  }

  private static boolean hasTimeZone(String typeName) {
    if (typeName == null) {
      return false;
    }
    String name = typeName.toLowerCase(Locale.ROOT);
    return name.endsWith("tz") || name.contains("time zone");
  }
}
