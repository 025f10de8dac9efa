package com.assistme.backend.integration.provider;

import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.service.IntegrationException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of provider services, assembled once at startup through {@link Builder}.
 * Lookups need no locking.
 */
public final class IntegrationProviderRegistry {

  private final Map<ProviderType, IntegrationProviderService> services;
  private final List<ProviderType> order;

  private IntegrationProviderRegistry(Map<ProviderType, IntegrationProviderService> services) {
    this.services = Map.copyOf(services);
    this.order = List.copyOf(services.keySet());
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Descriptors of registered providers that are enabled and have credentials. */
  public List<ProviderDescriptor> listAvailable() {
    return order.stream()
        .map(services::get)
        .filter(IntegrationProviderService::isAvailable)
        .map(IntegrationProviderService::descriptor)
        .toList();
  }

  public IntegrationProviderService get(ProviderType providerType) {
    return find(providerType)
        .orElseThrow(
            () ->
                IntegrationException.unknownProvider(
                    providerType != null ? providerType.id() : "null"));
  }

  public IntegrationProviderService get(String providerId) {
    ProviderType type =
        ProviderType.fromId(providerId)
            .orElseThrow(() -> IntegrationException.unknownProvider(providerId));
    return get(type);
  }

  public Optional<IntegrationProviderService> find(ProviderType providerType) {
    if (providerType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(services.get(providerType))
        .filter(IntegrationProviderService::isAvailable);
  }

  public Collection<ProviderType> registeredTypes() {
    return order;
  }

  public static final class Builder {

    private final Map<ProviderType, IntegrationProviderService> services = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(IntegrationProviderService service) {
      ProviderType type = service.providerType();
      if (services.putIfAbsent(type, service) != null) {
        throw new IllegalStateException("Provider already registered: " + type.id());
      }
      return this;
    }

    public IntegrationProviderRegistry build() {
      return new IntegrationProviderRegistry(services);
    }
  }
}
