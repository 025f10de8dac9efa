package com.assistme.backend.integration.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ProviderType {
  GMAIL("gmail", true),
  SLACK("slack", false),
  NOTION("notion", false),
  MICROSOFT("microsoft", true);

  private final String id;
  private final boolean email;

  ProviderType(String id, boolean email) {
    this.id = id;
    this.email = email;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public boolean isEmail() {
    return email;
  }

  public static Optional<ProviderType> fromId(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(type -> type.id.equals(normalized)).findFirst();
  }
}
