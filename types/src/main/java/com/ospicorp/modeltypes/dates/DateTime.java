package com.ospicorp.modeltypes.dates;

import static com.ospicorp.modeltypes.dates.DateLayouts.DEFAULT_SERVER_DATETIME_FORMAT;
import static com.ospicorp.modeltypes.dates.DateLayouts.DEFAULT_SERVER_DATE_FORMAT;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A date and time of a model field, at second precision.
 *
 * <p>Equality, text and JSON use {@code YYYY-MM-DD HH:MM:SS}; fractions of a
 * second stay in memory only. The zero date-time ({@code 0001-01-01 00:00:00})
 * is written to JSON as {@code false}, like {@link Date}.
 */
@JsonSerialize(using = CalendarValueSerializer.class)
@JsonDeserialize(using = CalendarValueDeserializer.ForDateTime.class)
public final class DateTime implements CalendarValue {

  public static final DateTime ZERO = new DateTime(Temporals.ZERO_INSTANT);

  private static final String ZERO_TEXT = Temporals.format(Temporals.ZERO_INSTANT,
      DEFAULT_SERVER_DATETIME_FORMAT);

  private final OffsetDateTime time;

  private DateTime(OffsetDateTime time) {
    this.time = Objects.requireNonNull(time, "time");
  }

  public static DateTime of(OffsetDateTime time) {
    return new DateTime(time);
  }

  public static DateTime of(int year, int month, int day, int hour, int minute, int second) {
    return new DateTime(OffsetDateTime.of(year, month, day, hour, minute, second, 0,
        ZoneOffset.UTC));
  }

  /** Returns the current date and time from the system clock. */
  public static DateTime now() {
    return new DateTime(OffsetDateTime.now());
  }

  public static DateTime now(Clock clock) {
    return new DateTime(OffsetDateTime.now(clock));
  }

  /**
   * Parses a {@code YYYY-MM-DD HH:MM:SS} literal. For trusted text only.
   *
   * @throws IllegalArgumentException if the text does not match the layout
   */
  public static DateTime parse(String value) {
    try {
      return parseWithLayout(DEFAULT_SERVER_DATETIME_FORMAT, value);
    } catch (DateParseException ex) {
      throw new IllegalArgumentException(ex.getMessage(), ex);
    }
  }

  public static DateTime parseWithLayout(String layout, String value) throws DateParseException {
    return new DateTime(Temporals.parse(layout, value));
  }

  /**
   * Converts a value read from the database. Strings are tried as a date-time,
   * then as a date at midnight.
   *
   * @throws ScanTypeException if the value is neither temporal nor a string
   */
  public static DateTime scan(Object src) throws SQLException {
    OffsetDateTime driverTime = Temporals.fromDriverValue(src);
    if (driverTime != null) {
      return new DateTime(driverTime);
    }
    if (src instanceof String text) {
      if (text.isEmpty()) {
        return ZERO;
      }
      return new DateTime(Temporals.parseScanned(text, DEFAULT_SERVER_DATETIME_FORMAT,
          DEFAULT_SERVER_DATE_FORMAT));
    }
    throw new ScanTypeException("datetime", src);
  }

  public OffsetDateTime time() {
    return time;
  }

  @Override
  public boolean isZero() {
    return ZERO_TEXT.equals(toString());
  }

  public Date toDate() {
    return Date.of(time);
  }

  /**
   * Returns the wall-clock date and time, {@code 0001-01-01T00:00} for the zero
   * value. Never {@code null}.
   */
  @Override
  public LocalDateTime toSqlValue() {
    return isZero() ? Temporals.ZERO_INSTANT.toLocalDateTime() : time.toLocalDateTime();
  }

  public boolean equal(DateTime other) {
    return toString().equals(other.toString());
  }

  public boolean greater(DateTime other) {
    return sub(other).compareTo(Duration.ZERO) > 0;
  }

  public boolean greaterEqual(DateTime other) {
    return sub(other).compareTo(Duration.ZERO) >= 0;
  }

  public boolean lower(DateTime other) {
    return sub(other).compareTo(Duration.ZERO) < 0;
  }

  public boolean lowerEqual(DateTime other) {
    return sub(other).compareTo(Duration.ZERO) <= 0;
  }

  public Duration sub(DateTime other) {
    return Temporals.between(other.time, time);
  }

  public DateTime add(Duration duration) {
    return new DateTime(time.plus(duration));
  }

  public DateTime addDate(int years, int months, int days) {
    return new DateTime(Temporals.addDate(time, years, months, days));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DateTime other && equal(other);
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    return Temporals.format(time, DEFAULT_SERVER_DATETIME_FORMAT);
  }
}
