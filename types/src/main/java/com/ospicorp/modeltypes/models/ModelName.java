package com.ospicorp.modeltypes.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/** Name of a model, such as {@code "Partner"}. */
public record ModelName(@JsonValue String value) {

  public ModelName {
    Objects.requireNonNull(value, "value");
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ModelName of(String value) {
    return new ModelName(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
