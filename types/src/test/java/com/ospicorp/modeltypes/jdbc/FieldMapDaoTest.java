package com.ospicorp.modeltypes.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.modeltypes.dates.Date;
import com.ospicorp.modeltypes.dates.DateTime;
import com.ospicorp.modeltypes.models.FieldMap;
import com.ospicorp.modeltypes.models.KeySubstitution;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class FieldMapDaoTest {

  private NamedParameterJdbcTemplate jdbc;
  private FieldMapDao dao;

  @BeforeEach
  void setUp() {
    jdbc = mock(NamedParameterJdbcTemplate.class);
    dao = new FieldMapDao(jdbc);
    when(jdbc.update(anyString(), any(SqlParameterSource.class))).thenReturn(1);
  }

  @Test
  void insertBindsConvertedValuesWithoutZeroPk() {
    FieldMap fields = new FieldMap()
        .put("id", 0L)
        .put("name", "Jane")
        .put("birth_date", Date.parse("1985-04-12"))
        .put("created_at", DateTime.ZERO);

    int inserted = dao.insert("partner", fields);

    ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
    ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
    verify(jdbc).update(sql.capture(), params.capture());
    assertThat(inserted).isEqualTo(1);
    assertThat(sql.getValue()).isEqualTo(
        "INSERT INTO partner (birth_date, created_at, name) VALUES (:birth_date, :created_at, :name)");
    assertThat(params.getValue().getValue("birth_date")).isEqualTo(LocalDate.of(1985, 4, 12));
    assertThat(params.getValue().getValue("created_at")).isEqualTo(LocalDateTime.of(1, 1, 1, 0, 0));
    assertThat(params.getValue().hasValue("id")).isFalse();
    assertThat(fields.containsKey("id")).isTrue();
  }

  @Test
  void insertKeepsAssignedPk() {
    dao.insert("partner", new FieldMap().put("id", 9L).put("name", "Jane"));

    ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
    verify(jdbc).update(anyString(), params.capture());
    assertThat(params.getValue().getValue("id")).isEqualTo(9L);
  }

  @Test
  void insertRenamesFieldsToColumns() {
    FieldMap fields = new FieldMap().put("Name", "Jane").put("BirthDate", Date.parse("1985-04-12"));

    dao.insert("partner", fields, List.of(
        KeySubstitution.rename("Name", "name"),
        KeySubstitution.rename("BirthDate", "birth_date")));

    ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
    verify(jdbc).update(sql.capture(), any(SqlParameterSource.class));
    assertThat(sql.getValue()).isEqualTo(
        "INSERT INTO partner (birth_date, name) VALUES (:birth_date, :name)");
  }

  @Test
  void insertRejectsInvalidIdentifiers() {
    assertThatThrownBy(() -> dao.insert("partner; DROP TABLE x", new FieldMap().put("name", "Jane")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> dao.insert("partner", new FieldMap().put("bad-name", "Jane")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("bad-name");
    assertThatThrownBy(() -> dao.insert("partner", new FieldMap().put("id", 0L)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("no column");
    verify(jdbc, never()).update(anyString(), any(SqlParameterSource.class));
  }

  @Test
  void findByIdReturnsFirstRow() {
    FieldMap row = new FieldMap().put("id", 3L);
    when(jdbc.query(anyString(), any(SqlParameterSource.class), any(FieldMapRowMapper.class)))
        .thenReturn(List.of(row));

    Optional<FieldMap> found = dao.findById("partner", 3L);

    ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
    ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
    verify(jdbc).query(sql.capture(), params.capture(), any(FieldMapRowMapper.class));
    assertThat(found).contains(row);
    assertThat(sql.getValue()).isEqualTo("SELECT * FROM partner WHERE id = :id");
    assertThat(params.getValue().getValue("id")).isEqualTo(3L);
  }

  @Test
  void findByIdIsEmptyWithoutRows() {
    when(jdbc.query(anyString(), any(SqlParameterSource.class), any(FieldMapRowMapper.class)))
        .thenReturn(List.of());

    assertThat(dao.findById("partner", 3L)).isEmpty();
  }

  @Test
  void findAllOrdersById() {
    when(jdbc.query(anyString(), any(FieldMapRowMapper.class))).thenReturn(List.of());

    assertThat(dao.findAll("partner")).isEmpty();
    verify(jdbc).query(eq("SELECT * FROM partner ORDER BY id"), any(FieldMapRowMapper.class));
  }
}
