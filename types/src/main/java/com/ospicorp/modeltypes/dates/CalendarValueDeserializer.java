package com.ospicorp.modeltypes.dates;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * Reads the canonical text of a calendar value. {@code false}, {@code null} and
 * the empty string read as the zero value.
 */
public abstract class CalendarValueDeserializer<T extends CalendarValue> extends StdDeserializer<T> {

  protected CalendarValueDeserializer(Class<T> type) {
    super(type);
  }

  protected abstract T zero();

  protected abstract T parseText(String text) throws DateParseException;

  @Override
  @SuppressWarnings("unchecked")
  public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonToken token = p.currentToken();
    if (token == JsonToken.VALUE_FALSE) {
      return zero();
    }
    if (token == JsonToken.VALUE_STRING) {
      String text = p.getText();
      if (text.isEmpty()) {
        return zero();
      }
      try {
        return parseText(text);
      } catch (DateParseException ex) {
        throw ctxt.weirdStringException(text, handledType(), ex.getMessage());
      }
    }
    return (T) ctxt.handleUnexpectedToken(handledType(), p);
  }

  @Override
  public T getNullValue(DeserializationContext ctxt) {
    return zero();
  }

  public static class ForDate extends CalendarValueDeserializer<Date> {

    public ForDate() {
      super(Date.class);
    }

    @Override
    protected Date zero() {
      return Date.ZERO;
    }

    @Override
    protected Date parseText(String text) throws DateParseException {
      try {
        return Date.parseWithLayout(DateLayouts.DEFAULT_SERVER_DATE_FORMAT, text);
      } catch (DateParseException ex) {
        return Date.parseWithLayout(DateLayouts.DEFAULT_SERVER_DATETIME_FORMAT, text);
      }
    }
  }

  public static class ForDateTime extends CalendarValueDeserializer<DateTime> {

    public ForDateTime() {
      super(DateTime.class);
    }

    @Override
    protected DateTime zero() {
      return DateTime.ZERO;
    }

    @Override
    protected DateTime parseText(String text) throws DateParseException {
      try {
        return DateTime.parseWithLayout(DateLayouts.DEFAULT_SERVER_DATETIME_FORMAT, text);
      } catch (DateParseException ex) {
        return DateTime.parseWithLayout(DateLayouts.DEFAULT_SERVER_DATE_FORMAT, text);
      }
    }
  }
}
