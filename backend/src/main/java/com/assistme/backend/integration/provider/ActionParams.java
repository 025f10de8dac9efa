package com.assistme.backend.integration.provider;

import com.assistme.backend.integration.service.IntegrationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Typed access to the JSON parameters of an action; violations become {@code INVALID_PARAMS}. */
public final class ActionParams {

  private final JsonNode node;

  private ActionParams(JsonNode node) {
    this.node = node;
  }

  public static ActionParams of(JsonNode params) {
    if (params == null || params.isNull() || params.isMissingNode()) {
      return new ActionParams(MissingNode.getInstance());
    }
    if (!params.isObject()) {
      throw IntegrationException.invalidParams("params must be a JSON object");
    }
    return new ActionParams(params);
  }

  public Optional<String> text(String name, int maxLength) {
    JsonNode value = node.path(name);
    if (value.isMissingNode() || value.isNull()) {
      return Optional.empty();
    }
    if (!value.isTextual()) {
      throw IntegrationException.invalidParams(name + " must be a string");
    }
    String text = value.asText().trim();
    if (text.length() > maxLength) {
      throw IntegrationException.invalidParams(name + " is too long");
    }
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  public String requiredText(String name, int maxLength) {
    return text(name, maxLength)
        .orElseThrow(() -> IntegrationException.invalidParams(name + " is required"));
  }

  public int integer(String name, int min, int max, int defaultValue) {
    JsonNode value = node.path(name);
    if (value.isMissingNode() || value.isNull()) {
      return defaultValue;
    }
    int parsed;
    if (value.isIntegralNumber() && value.canConvertToInt()) {
      parsed = value.intValue();
    } else if (value.isTextual() && value.asText().trim().matches("-?\\d{1,9}")) {
      parsed = Integer.parseInt(value.asText().trim());
    } else {
      throw IntegrationException.invalidParams(name + " must be an integer");
    }
    if (parsed < min || parsed > max) {
      throw IntegrationException.invalidParams(
          name + " must be between " + min + " and " + max);
    }
    return parsed;
  }

  /** Accepts either a JSON array of strings or a single string. */
  public List<String> textList(String name) {
    JsonNode value = node.path(name);
    if (value.isMissingNode() || value.isNull()) {
      return List.of();
    }
    if (value.isTextual()) {
      String text = value.asText().trim();
      return text.isEmpty() ? List.of() : List.of(text);
    }
    if (!value.isArray()) {
      throw IntegrationException.invalidParams(name + " must be a list of strings");
    }
    List<String> values = new ArrayList<>();
    for (JsonNode item : value) {
      if (!item.isTextual()) {
        throw IntegrationException.invalidParams(name + " must be a list of strings");
      }
      if (!item.asText().isBlank()) {
        values.add(item.asText().trim());
      }
    }
    return List.copyOf(values);
  }
}
