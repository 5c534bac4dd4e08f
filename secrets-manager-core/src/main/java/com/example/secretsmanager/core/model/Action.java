package com.example.secretsmanager.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Operations subject to access control. */
public enum Action {
  READ,
  WRITE,
  DELETE,
  ROTATE,
  LIST;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Action fromCode(final String code) {
    return valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
