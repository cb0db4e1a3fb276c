package com.ospicorp.modeltypes.dates;

import static com.ospicorp.modeltypes.dates.DateLayouts.DEFAULT_SERVER_DATETIME_FORMAT;
import static com.ospicorp.modeltypes.dates.DateLayouts.DEFAULT_SERVER_DATE_FORMAT;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A calendar date of a model field.
 *
 * <p>The wrapped instant keeps its time of day and offset in memory, but equality,
 * text and JSON only look at the {@code YYYY-MM-DD} part. A date whose text equals
 * the text of the zero instant ({@code 0001-01-01}) is the zero date, meaning "no
 * date set". It is written to JSON as {@code false} and to the database as the
 * zero instant's day.
 */
@JsonSerialize(using = CalendarValueSerializer.class)
@JsonDeserialize(using = CalendarValueDeserializer.ForDate.class)
public final class Date implements CalendarValue {

  public static final Date ZERO = new Date(Temporals.ZERO_INSTANT);

  private static final String ZERO_TEXT = Temporals.format(Temporals.ZERO_INSTANT,
      DEFAULT_SERVER_DATE_FORMAT);

  private final OffsetDateTime time;

  private Date(OffsetDateTime time) {
    this.time = Objects.requireNonNull(time, "time");
  }

  public static Date of(OffsetDateTime time) {
    return new Date(time);
  }

  public static Date of(int year, int month, int day) {
    return new Date(OffsetDateTime.of(year, month, day, 0, 0, 0, 0, ZoneOffset.UTC));
  }

  /** Returns the current date from the system clock. */
  public static Date today() {
    return new Date(OffsetDateTime.now());
  }

  public static Date today(Clock clock) {
    return new Date(OffsetDateTime.now(clock));
  }

  /**
   * Parses a {@code YYYY-MM-DD} literal.
   *
   * <p>Only for text known to be well formed, such as constants in code. Malformed
   * input aborts the caller with an unchecked exception; user supplied text goes
   * through {@link #parseWithLayout(String, String)}.
   *
   * @throws IllegalArgumentException if the text is not a {@code YYYY-MM-DD} date
   */
  public static Date parse(String value) {
    try {
      return parseWithLayout(DEFAULT_SERVER_DATE_FORMAT, value);
    } catch (DateParseException ex) {
      throw new IllegalArgumentException(ex.getMessage(), ex);
    }
  }

  /**
   * Parses text formatted with the given layout. Empty text gives {@link #ZERO}.
   */
  public static Date parseWithLayout(String layout, String value) throws DateParseException {
    return new Date(Temporals.parse(layout, value));
  }

  /**
   * Converts a value read from the database.
   *
   * <p>Temporal driver values are taken as they are. Strings are parsed as a date,
   * then as a date-time, and the empty string is the zero date.
   *
   * @throws ScanTypeException if the value is of any other type
   * @throws java.sql.SQLDataException if a string matches neither layout
   */
  public static Date scan(Object src) throws SQLException {
    OffsetDateTime driverTime = Temporals.fromDriverValue(src);
    if (driverTime != null) {
      return new Date(driverTime);
    }
    if (src instanceof String text) {
      if (text.isEmpty()) {
        return ZERO;
      }
      return new Date(Temporals.parseScanned(text, DEFAULT_SERVER_DATE_FORMAT,
          DEFAULT_SERVER_DATETIME_FORMAT));
    }
    throw new ScanTypeException("date", src);
  }

  /** The wrapped instant, including the time of day. */
  public OffsetDateTime time() {
    return time;
  }

  public int getYear() {
    return time.getYear();
  }

  public int getMonthValue() {
    return time.getMonthValue();
  }

  public int getDayOfMonth() {
    return time.getDayOfMonth();
  }

  @Override
  public boolean isZero() {
    return ZERO_TEXT.equals(toString());
  }

  /** The date-time at the same instant. */
  public DateTime toDateTime() {
    return DateTime.of(time);
  }

  /**
   * Returns the calendar day, {@code 0001-01-01} for the zero date. Never
   * {@code null}. The day is bound without time or offset so that the session
   * time zone of the connection cannot move it.
   */
  @Override
  public LocalDate toSqlValue() {
    return isZero() ? Temporals.ZERO_INSTANT.toLocalDate() : time.toLocalDate();
  }

  /** Reports whether both values fall on the same calendar day. */
  public boolean equal(Date other) {
    return toString().equals(other.toString());
  }

  public boolean greater(Date other) {
    return sub(other).compareTo(Duration.ZERO) > 0;
  }

  public boolean greaterEqual(Date other) {
    return sub(other).compareTo(Duration.ZERO) >= 0;
  }

  public boolean lower(Date other) {
    return sub(other).compareTo(Duration.ZERO) < 0;
  }

  public boolean lowerEqual(Date other) {
    return sub(other).compareTo(Duration.ZERO) <= 0;
  }

  /**
   * Returns {@code this - other}. Results beyond the range of a 64-bit nanosecond
   * count are clamped to its maximum or minimum.
   */
  public Duration sub(Date other) {
    return Temporals.between(other.time, time);
  }

  /**
   * Adds calendar years, months and days. A day past the end of the resulting
   * month rolls over into the next one.
   */
  public Date addDate(int years, int months, int days) {
    return new Date(Temporals.addDate(time, years, months, days));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Date other && equal(other);
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    return Temporals.format(time, DEFAULT_SERVER_DATE_FORMAT);
  }
}
