package com.ospicorp.modeltypes.dates;

/**
 * Raised when text does not match the layout it is parsed with.
 */
public class DateParseException extends Exception {
  private final String text;
  private final String layout;

  public DateParseException(String text, String layout, Throwable cause) {
    super("cannot parse \"" + text + "\" as \"" + layout + "\": " + cause.getMessage(), cause);
    this.text = text;
    this.layout = layout;
  }

  public String text() {
    return text;
  }

  public String layout() {
    return layout;
  }
}
