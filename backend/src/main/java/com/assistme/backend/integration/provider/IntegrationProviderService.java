package com.assistme.backend.integration.provider;

import com.assistme.backend.integration.domain.ProviderType;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Capabilities every third-party provider implements. All upstream failures leave an
 * implementation as {@link com.assistme.backend.integration.service.IntegrationException}.
 */
public interface IntegrationProviderService {

  ProviderType providerType();

  ProviderDescriptor descriptor();

  /** Whether the provider is enabled and has client credentials configured. */
  boolean isAvailable();

  URI buildAuthorizationUri(String state, String redirectUri, List<String> requestedScopes);

  TokenBundle exchangeCode(String code, String redirectUri);

  boolean needsRefresh(ProviderTokens tokens, Instant now);

  /**
   * @throws TokenRefreshException terminal when the refresh token is revoked or missing, transient
   *     on network or provider side failures
   */
  TokenBundle refresh(ProviderTokens tokens);

  Set<String> supportedActions();

  JsonNode execute(ProviderTokens tokens, String action, JsonNode params);
}
