package com.ospicorp.modeltypes.dates;

import com.ospicorp.modeltypes.jdbc.SqlValuer;

/**
 * Common contract of the model temporal types: zero detection, canonical text
 * through {@link Object#toString()} and conversion for the database.
 */
public interface CalendarValue extends SqlValuer {

  /**
   * Reports whether the value formats like the zero instant at its type's precision.
   */
  boolean isZero();
}
