package io.upreview.backend.review;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Which button the recipient pressed in the invitation email. */
public enum ReviewType {
  GOOD,
  BAD;

  public boolean isHappy() {
    return this == GOOD;
  }

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ReviewType fromWireValue(String value) {
    return value == null ? null : ReviewType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
