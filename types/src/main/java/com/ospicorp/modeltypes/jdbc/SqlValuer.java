package com.ospicorp.modeltypes.jdbc;

/**
 * A value that converts itself before being bound as a statement parameter.
 */
public interface SqlValuer {

  /**
   * Returns the object handed to the JDBC driver.
   */
  Object toSqlValue();
}
