package com.ospicorp.modeltypes.dates;

import java.sql.SQLDataException;
import java.sql.Timestamp;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Instant plumbing shared by Date and DateTime.
final class Temporals {

  private static final Logger log = LoggerFactory.getLogger(Temporals.class);

  static final OffsetDateTime ZERO_INSTANT = OffsetDateTime.of(1, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  private static final Duration MAX_DURATION = Duration.ofNanos(Long.MAX_VALUE);
  private static final Duration MIN_DURATION = Duration.ofNanos(Long.MIN_VALUE);

  private Temporals() {
  }

  static String format(OffsetDateTime time, String layout) {
    return time.format(DateLayouts.formatter(layout));
  }

  /**
   * Parses text under the layout. Empty text is the zero instant. Missing time
   * fields default to midnight. A parsed offset or zone id is applied, otherwise
   * the value is at UTC. An invalid layout is reported like unparsable text.
   */
  static OffsetDateTime parse(String layout, String text) throws DateParseException {
    if (text == null || text.isEmpty()) {
      return ZERO_INSTANT;
    }
    try {
      TemporalAccessor parsed = DateLayouts.formatter(layout).parse(text);
      LocalDate date = LocalDate.from(parsed);
      LocalDateTime local = parsed.isSupported(ChronoField.HOUR_OF_DAY)
          ? LocalDateTime.from(parsed)
          : date.atStartOfDay();
      ZoneId zone = parsed.query(TemporalQueries.zone());
      if (zone == null) {
        return OffsetDateTime.of(local, ZoneOffset.UTC);
      }
      return ZonedDateTime.of(local, zone).toOffsetDateTime();
    } catch (DateTimeException | IllegalArgumentException ex) {
      throw new DateParseException(text, layout, ex);
    }
  }

  /**
   * Parses a scanned string under the primary layout, then under the fallback
   * layout so that date-only text fits date-time columns and the reverse.
   */
  static OffsetDateTime parseScanned(String text, String primary, String fallback)
      throws SQLDataException {
    try {
      return parse(primary, text);
    } catch (DateParseException first) {
      log.debug("Scanned value \"{}\" does not match {}, trying {}", text, primary, fallback);
      try {
        return parse(fallback, text);
      } catch (DateParseException second) {
        second.addSuppressed(first);
        log.warn("Scanned value \"{}\" matches neither {} nor {}", text, primary, fallback);
        throw new SQLDataException(second.getMessage(), "22007", second);
      }
    }
  }

  /**
   * Converts a driver value that already is a point in time. Returns
   * {@code null} when the source is not a temporal type.
   */
  static OffsetDateTime fromDriverValue(Object src) {
    if (src instanceof OffsetDateTime time) {
      return time;
    }
    if (src instanceof ZonedDateTime time) {
      return time.toOffsetDateTime();
    }
    if (src instanceof LocalDateTime time) {
      return time.atOffset(ZoneOffset.UTC);
    }
    if (src instanceof LocalDate date) {
      return date.atStartOfDay().atOffset(ZoneOffset.UTC);
    }
    if (src instanceof Instant instant) {
      return instant.atOffset(ZoneOffset.UTC);
    }
    // Legacy JDBC values all read as their wall clock in the JVM zone, labelled UTC
    // like the other local values.
    if (src instanceof Timestamp timestamp) {
      return timestamp.toLocalDateTime().atOffset(ZoneOffset.UTC);
    }
    if (src instanceof java.sql.Date date) {
      return date.toLocalDate().atStartOfDay().atOffset(ZoneOffset.UTC);
    }
    // a time of day without a date is not a point in time
    if (src instanceof java.sql.Time) {
      return null;
    }
    if (src instanceof java.util.Date date) {
      return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault())
          .atOffset(ZoneOffset.UTC);
    }
    return null;
  }

  /**
   * Returns {@code to - from}, clamped to the range of a signed 64-bit
   * nanosecond count.
   */
  static Duration between(OffsetDateTime from, OffsetDateTime to) {
    Duration duration = Duration.between(from, to);
    if (duration.compareTo(MAX_DURATION) > 0) {
      return MAX_DURATION;
    }
    if (duration.compareTo(MIN_DURATION) < 0) {
      return MIN_DURATION;
    }
    return duration;
  }

  /**
   * Shifts by calendar units. Days past the end of the target month roll into
   * the following month (January 31 plus one month is March 3 or 2) instead of
   * being clamped to the last day.
   */
  static OffsetDateTime addDate(OffsetDateTime time, int years, int months, int days) {
    LocalDate firstOfMonth = time.toLocalDate()
        .withDayOfMonth(1)
        .plusYears(years)
        .plusMonths(months);
    LocalDate shifted = firstOfMonth.plusDays(time.getDayOfMonth() - 1L + days);
    return OffsetDateTime.of(shifted, time.toLocalTime(), time.getOffset());
  }
}
