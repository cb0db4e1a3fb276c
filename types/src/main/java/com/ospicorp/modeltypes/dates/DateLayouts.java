package com.ospicorp.modeltypes.dates;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Text layouts shared by {@link Date} and {@link DateTime}.
 *
 * <p>Layouts are {@link DateTimeFormatter} patterns resolved strictly, so an
 * out-of-range field such as month 13 or February 30 is a parse error rather than
 * a silently adjusted value. Patterns use {@code uuuu} (proleptic year) because
 * strict resolution of {@code yyyy} would require an era field.
 */
public final class DateLayouts {

  /** Canonical layout of {@link Date} values: {@code YYYY-MM-DD}. */
  public static final String DEFAULT_SERVER_DATE_FORMAT = "uuuu-MM-dd";

  /** Canonical layout of {@link DateTime} values: {@code YYYY-MM-DD HH:MM:SS}. */
  public static final String DEFAULT_SERVER_DATETIME_FORMAT = "uuuu-MM-dd HH:mm:ss";

  private static final Map<String, DateTimeFormatter> FORMATTERS = new ConcurrentHashMap<>();

  private DateLayouts() {
  }

  /**
   * Returns the strict formatter for the given layout.
   *
   * @throws IllegalArgumentException if the layout is not a valid pattern
   */
  public static DateTimeFormatter formatter(String layout) {
    return FORMATTERS.computeIfAbsent(layout,
        pattern -> DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT));
  }
}
