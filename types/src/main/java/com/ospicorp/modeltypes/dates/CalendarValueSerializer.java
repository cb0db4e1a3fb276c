package com.ospicorp.modeltypes.dates;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/**
 * Writes a zero value as {@code false} and any other value as its canonical text.
 */
public class CalendarValueSerializer extends StdSerializer<CalendarValue> {

  public CalendarValueSerializer() {
    super(CalendarValue.class);
  }

  @Override
  public void serialize(CalendarValue value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    if (value.isZero()) {
      gen.writeBoolean(false);
      return;
    }
    gen.writeString(value.toString());
  }
}
