package com.ospicorp.modeltypes.models;

import java.util.Objects;

/**
 * Renames the {@code orig} key of a {@link FieldMap} to {@code replacement},
 * keeping the original entry when {@code keep} is set.
 */
public record KeySubstitution(String orig, String replacement, boolean keep) {

  public KeySubstitution {
    Objects.requireNonNull(orig, "orig");
    Objects.requireNonNull(replacement, "replacement");
  }

  public static KeySubstitution rename(String orig, String replacement) {
    return new KeySubstitution(orig, replacement, false);
  }

  public static KeySubstitution copy(String orig, String replacement) {
    return new KeySubstitution(orig, replacement, true);
  }
}
