package com.ospicorp.modeltypes.models;

import java.util.Objects;

/**
 * Identifies a record by its model and id.
 */
public record RecordRef(ModelName modelName, long id) {

  public RecordRef {
    Objects.requireNonNull(modelName, "modelName");
  }

  public static RecordRef of(String modelName, long id) {
    return new RecordRef(ModelName.of(modelName), id);
  }
}
