package com.assistme.backend.integration.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IntegrationStatus {
  ACTIVE,
  EXPIRED,
  ERROR,
  DISCONNECTED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static IntegrationStatus fromValue(String value) {
    if (value == null) {
      return null;
    }
    return IntegrationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
