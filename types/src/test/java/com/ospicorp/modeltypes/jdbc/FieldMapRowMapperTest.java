package com.ospicorp.modeltypes.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

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
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FieldMapRowMapperTest {

  private ResultSet rs;
  private ResultSetMetaData meta;

  @BeforeEach
  void mockRow() throws SQLException {
    rs = mock(ResultSet.class);
    meta = mock(ResultSetMetaData.class);
    when(rs.getMetaData()).thenReturn(meta);
    when(meta.getColumnCount()).thenReturn(5);
    column(1, "id", Types.BIGINT, "int8");
    column(2, "name", Types.VARCHAR, "varchar");
    column(3, "birth_date", Types.DATE, "date");
    column(4, "created_at", Types.TIMESTAMP, "timestamp");
    column(5, "updated_at", Types.TIMESTAMP, "timestamptz");
    when(rs.getObject(1)).thenReturn(5L);
    when(rs.getObject(2)).thenReturn("Jane");
  }

  private void column(int index, String label, int type, String typeName) throws SQLException {
    when(meta.getColumnLabel(index)).thenReturn(label);
    when(meta.getColumnType(index)).thenReturn(type);
    when(meta.getColumnTypeName(index)).thenReturn(typeName);
  }

  @Test
  void mapsTemporalColumnsToModelTypes() throws SQLException {
    when(rs.getObject(3, LocalDate.class)).thenReturn(LocalDate.of(1985, 4, 12));
    when(rs.getObject(4, LocalDateTime.class)).thenReturn(LocalDateTime.of(2017, 8, 1, 10, 2, 57));
    when(rs.getObject(5, OffsetDateTime.class))
        .thenReturn(OffsetDateTime.of(2017, 8, 2, 8, 0, 0, 0, ZoneOffset.UTC));

    FieldMap row = new FieldMapRowMapper().mapRow(rs, 0);

    assertThat(row.get("id")).isEqualTo(5L);
    assertThat(row.get("name")).isEqualTo("Jane");
    assertThat(row.get("birth_date")).isEqualTo(Date.parse("1985-04-12"));
    assertThat(row.get("created_at")).isEqualTo(DateTime.parse("2017-08-01 10:02:57"));
    assertThat(row.get("updated_at")).isEqualTo(DateTime.parse("2017-08-02 08:00:00"));
  }

  @Test
  void nullTemporalColumnsReadAsZero() throws SQLException {
    FieldMap row = new FieldMapRowMapper().mapRow(rs, 0);

    assertThat(row.get("birth_date")).isInstanceOfSatisfying(Date.class,
        date -> assertThat(date.isZero()).isTrue());
    assertThat(row.get("created_at")).isInstanceOfSatisfying(DateTime.class,
        stamp -> assertThat(stamp.isZero()).isTrue());
    assertThat(row.get("updated_at")).isEqualTo(DateTime.ZERO);
  }
}
