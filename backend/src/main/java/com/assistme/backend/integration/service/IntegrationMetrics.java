package com.assistme.backend.integration.service;

import com.assistme.backend.integration.domain.ProviderType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class IntegrationMetrics {

  private final MeterRegistry meterRegistry;

  public IntegrationMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    MeterRegistry registry = meterRegistry.getIfAvailable();
    this.meterRegistry = registry != null ? registry : new SimpleMeterRegistry();
  }

  public void tokenRefresh(String outcome) {
    meterRegistry.counter("integration_token_refresh", "outcome", outcome).increment();
  }

  public void action(ProviderType providerType, String outcome) {
    meterRegistry
        .counter("integration_action", "provider", providerType.id(), "outcome", outcome)
        .increment();
  }

  public void connection(ProviderType providerType, String outcome) {
    meterRegistry
        .counter("integration_connection", "provider", providerType.id(), "outcome", outcome)
        .increment();
  }
}
