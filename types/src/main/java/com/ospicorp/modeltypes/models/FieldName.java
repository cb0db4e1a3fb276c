package com.ospicorp.modeltypes.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/** Name of a field in a model. */
public record FieldName(@JsonValue String value) {

  public FieldName {
    Objects.requireNonNull(value, "value");
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static FieldName of(String value) {
    return new FieldName(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
