package com.ospicorp.modeltypes.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column values of one record, keyed by column or field name. Iteration order is
 * unspecified.
 *
 * <p>Not thread-safe.
 */
public class FieldMap {

  public static final String PK_LOWER = "id";
  public static final String PK_UPPER = "ID";

  private final Map<String, Object> values;

  public FieldMap() {
    this.values = new HashMap<>();
  }

  public FieldMap(Map<String, ?> values) {
    this.values = new HashMap<>(values);
  }

  public List<String> keys() {
    return new ArrayList<>(values.keySet());
  }

  public List<Object> values() {
    return new ArrayList<>(values.values());
  }

  public Object get(String key) {
    return values.get(key);
  }

  public FieldMap put(String key, Object value) {
    values.put(Objects.requireNonNull(key, "key"), value);
    return this;
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  public Object remove(String key) {
    return values.remove(key);
  }

  public int size() {
    return values.size();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return values.isEmpty();
  }

  @JsonAnyGetter
  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  @JsonAnySetter
  private void set(String key, Object value) {
    put(key, value);
  }

  /** Removes the primary key entries, {@code id} and {@code ID}. */
  public void removePk() {
    values.remove(PK_LOWER);
    values.remove(PK_UPPER);
  }

  /**
   * Removes the primary key entries whose value is the integer zero, as set on a
   * record that has not been stored yet. Other values are kept.
   */
  public void removePkIfZero() {
    removeIfZero(PK_LOWER);
    removeIfZero(PK_UPPER);
  }

  private void removeIfZero(String key) {
    Object id = values.get(key);
    if (id instanceof Long || id instanceof Integer || id instanceof Short || id instanceof Byte) {
      if (((Number) id).longValue() == 0L) {
        values.remove(key);
      }
    }
  }

  /**
   * Renames keys in order. A substitution whose original key is missing is
   * skipped; with {@link KeySubstitution#keep()} the original entry stays as well.
   */
  public void substituteKeys(List<KeySubstitution> substitutions) {
    for (KeySubstitution subs : substitutions) {
      if (!values.containsKey(subs.orig())) {
        continue;
      }
      Object value = values.get(subs.orig());
      if (!subs.keep()) {
        values.remove(subs.orig());
      }
      values.put(subs.replacement(), value);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldMap other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "FieldMap" + values;
  }
}
