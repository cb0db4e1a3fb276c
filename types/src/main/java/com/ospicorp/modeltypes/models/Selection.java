package com.ospicorp.modeltypes.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Allowed {@code key -> label} values of a selection field, in declaration order.
 */
public final class Selection {

  private final Map<String, String> options;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public Selection(Map<String, String> options) {
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
  }

  @JsonValue
  public Map<String, String> options() {
    return options;
  }

  public Optional<String> label(String key) {
    return Optional.ofNullable(options.get(key));
  }

  public boolean contains(String key) {
    return options.containsKey(key);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Selection other && options.equals(other.options);
  }

  @Override
  public int hashCode() {
    return options.hashCode();
  }

  @Override
  public String toString() {
    return "Selection" + options;
  }
}
