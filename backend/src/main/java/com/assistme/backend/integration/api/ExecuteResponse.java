package com.assistme.backend.integration.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ExecuteResponse(boolean success, JsonNode data, String error) {

  public static ExecuteResponse success(JsonNode data) {
    return new ExecuteResponse(true, data, null);
  }

  public static ExecuteResponse failure(String error) {
    return new ExecuteResponse(false, null, error);
  }
}
