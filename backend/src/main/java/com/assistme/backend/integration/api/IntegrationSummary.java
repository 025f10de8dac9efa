package com.assistme.backend.integration.api;

import com.assistme.backend.integration.domain.Integration;
import com.assistme.backend.integration.domain.IntegrationStatus;
import com.assistme.backend.integration.domain.ProviderType;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record IntegrationSummary(
    UUID id,
    @JsonProperty("provider_type") ProviderType providerType,
    IntegrationStatus status,
    Map<String, Object> config,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  public static IntegrationSummary from(Integration integration) {
    return new IntegrationSummary(
        integration.getId(),
        integration.getProviderType(),
        integration.getStatus(),
        Collections.unmodifiableMap(withoutNullValues(integration.getConfig())),
        integration.getCreatedAt(),
        integration.getUpdatedAt());
  }

  private static Map<String, Object> withoutNullValues(Map<String, Object> config) {
    Map<String, Object> copy = new LinkedHashMap<>();
    config.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            copy.put(key, value);
          }
        });
    return copy;
  }
}
