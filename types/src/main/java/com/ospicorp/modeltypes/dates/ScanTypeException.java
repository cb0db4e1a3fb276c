package com.ospicorp.modeltypes.dates;

import java.sql.SQLException;

/**
 * Raised when a database value of an unsupported Java type is scanned into a
 * {@link Date} or {@link DateTime}.
 */
public class ScanTypeException extends SQLException {
  // SQLSTATE "invalid character value for cast"
  private static final String SQL_STATE = "22018";

  private final transient Object source;

  public ScanTypeException(String target, Object source) {
    super(target + " data is not a temporal value or string but "
        + (source == null ? "null" : source.getClass().getName()), SQL_STATE);
    this.source = source;
  }

  public Object source() {
    return source;
  }
}
