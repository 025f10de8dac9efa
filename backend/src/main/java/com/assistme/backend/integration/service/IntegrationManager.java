package com.assistme.backend.integration.service;

import com.assistme.backend.integration.api.ConnectResponse;
import com.assistme.backend.integration.api.IntegrationSummary;
import com.assistme.backend.integration.api.IntegrationUpdateRequest;
import com.assistme.backend.integration.config.IntegrationProperties;
import com.assistme.backend.integration.domain.Integration;
import com.assistme.backend.integration.domain.IntegrationStatus;
import com.assistme.backend.integration.domain.OAuthStateRecord;
import com.assistme.backend.integration.persistence.IntegrationRepository;
import com.assistme.backend.integration.provider.IntegrationProviderRegistry;
import com.assistme.backend.integration.provider.IntegrationProviderService;
import com.assistme.backend.integration.provider.ProviderDescriptor;
import com.assistme.backend.integration.provider.ProviderTokens;
import com.assistme.backend.integration.provider.TokenBundle;
import com.assistme.backend.integration.provider.TokenRefreshException;
import com.assistme.backend.integration.security.TokenDecryptionException;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Lifecycle of third-party integrations: connect, callback, listing, updates, disconnect and
 * action execution with transparent token refresh.
 *
 * <p>Status transitions: a successful callback makes an integration {@code active}; a terminal
 * refresh failure makes it {@code expired}; unreadable credentials or a failed upstream action
 * make it {@code error}, and the next successful action returns it to {@code active};
 * {@code disconnected} is only left through a new callback.
 */
@Service
public class IntegrationManager {

  private static final Logger log = LoggerFactory.getLogger(IntegrationManager.class);
  private static final int MAX_REDIRECT_LENGTH = 512;

  private final IntegrationProviderRegistry registry;
  private final OAuthStateStore stateStore;
  private final IntegrationTokenService tokenService;
  private final IntegrationRepository integrationRepository;
  private final IntegrationProperties properties;
  private final IntegrationMetrics metrics;
  private final Clock clock;

  public IntegrationManager(
      IntegrationProviderRegistry registry,
      OAuthStateStore stateStore,
      IntegrationTokenService tokenService,
      IntegrationRepository integrationRepository,
      IntegrationProperties properties,
      IntegrationMetrics metrics,
      Clock clock) {
    this.registry = registry;
    this.stateStore = stateStore;
    this.tokenService = tokenService;
    this.integrationRepository = integrationRepository;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public List<ProviderDescriptor> listAvailableProviders() {
    return registry.listAvailable();
  }

  public ConnectResponse connect(UUID ownerId, String providerId, String redirectUri) {
    return connect(ownerId, providerId, redirectUri, List.of());
  }

  public ConnectResponse connect(
      UUID ownerId, String providerId, String redirectUri, List<String> requestedScopes) {
    IntegrationProviderService provider = registry.get(providerId);
    validateRedirectUri(redirectUri);
    String state = stateStore.create(ownerId, provider.providerType(), redirectUri.trim());
    URI authorizationUri =
        provider.buildAuthorizationUri(
            state, properties.getCallbackUrl(), requestedScopes != null ? requestedScopes : List.of());
    log.info("Started {} authorization for owner {}", provider.providerType().id(), ownerId);
    return new ConnectResponse(authorizationUri.toString(), state);
  }

  /**
   * Completes an authorization. The integration always belongs to the owner recorded with the
   * state, never to whoever presents the callback.
   *
   * @throws IntegrationException {@code INVALID_OR_EXPIRED_STATE} on unknown, expired or reused
   *     state, or the exchange failure
   */
  public IntegrationSummary handleCallback(String state, String code) {
    CallbackOutcome outcome = completeCallback(state, code, null);
    if (!outcome.successful()) {
      throw outcome.failure();
    }
    return outcome.integration();
  }

  /**
   * Variant of {@link #handleCallback} for the redirect endpoint: once the state is consumed, a
   * provider error or exchange failure is reported in the outcome so the caller can still be sent
   * back to its redirect URI.
   */
  public CallbackOutcome completeCallback(String state, String code, String providerError) {
    OAuthStateRecord record = stateStore.consume(state);
    String redirectUri = record.getRedirectUri();
    if (StringUtils.hasText(providerError)) {
      log.info(
          "Authorization for {} declined for owner {}",
          record.getProviderType().id(),
          record.getOwnerId());
      metrics.connection(record.getProviderType(), "declined");
      return CallbackOutcome.failure(
          redirectUri,
          new IntegrationException(
              IntegrationErrorCode.TOKEN_EXCHANGE_FAILED, "Authorization was declined"));
    }
    try {
      IntegrationProviderService provider = registry.get(record.getProviderType());
      TokenBundle bundle = provider.exchangeCode(code, properties.getCallbackUrl());
      Integration integration =
          tokenService.storeConnection(record.getOwnerId(), record.getProviderType(), bundle);
      log.info(
          "Connected {} integration {} for owner {}",
          record.getProviderType().id(),
          integration.getId(),
          record.getOwnerId());
      metrics.connection(record.getProviderType(), "success");
      return CallbackOutcome.success(redirectUri, IntegrationSummary.from(integration));
    } catch (IntegrationException ex) {
      metrics.connection(record.getProviderType(), "failure");
      return CallbackOutcome.failure(redirectUri, ex);
    } catch (DataAccessException ex) {
      log.warn(
          "Storing {} connection for owner {} failed",
          record.getProviderType().id(),
          record.getOwnerId(),
          ex);
      metrics.connection(record.getProviderType(), "failure");
      return CallbackOutcome.failure(
          redirectUri,
          new IntegrationException(
              IntegrationErrorCode.CONNECTION_NOT_STORED,
              IntegrationErrorCode.CONNECTION_NOT_STORED.defaultMessage(),
              ex));
    }
  }

  @Transactional(readOnly = true)
  public List<IntegrationSummary> list(UUID ownerId) {
    return integrationRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId).stream()
        .map(IntegrationSummary::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public IntegrationSummary get(UUID ownerId, UUID integrationId) {
    return IntegrationSummary.from(loadOwned(ownerId, integrationId));
  }

  /** Deletes the integration's tokens and marks it {@code disconnected}. */
  @Transactional
  public void disconnect(UUID ownerId, UUID integrationId) {
    Integration integration = loadOwned(ownerId, integrationId);
    tokenService.revokeTokens(integration);
    integration.setStatus(IntegrationStatus.DISCONNECTED);
    integrationRepository.save(integration);
    log.info("Disconnected integration {} of owner {}", integrationId, ownerId);
  }

  /** Applies a status change (active or disconnected only) and merges config keys. */
  @Transactional
  public IntegrationSummary update(
      UUID ownerId, UUID integrationId, IntegrationUpdateRequest request) {
    Integration integration = loadOwned(ownerId, integrationId);
    if (request.status() != null) {
      if (request.status() == IntegrationStatus.DISCONNECTED) {
        tokenService.revokeTokens(integration);
      } else if (request.status() != IntegrationStatus.ACTIVE) {
        throw new IntegrationException(
            IntegrationErrorCode.INVALID_UPDATE,
            "Only active or disconnected status are supported");
      } else if (integration.getStatus() == IntegrationStatus.DISCONNECTED) {
        throw new IntegrationException(
            IntegrationErrorCode.INVALID_UPDATE, "Disconnected integrations must be reconnected");
      }
      integration.setStatus(request.status());
    }
    if (request.config() != null && !request.config().isEmpty()) {
      Map<String, Object> merged = new LinkedHashMap<>(integration.getConfig());
      request.config().forEach(
          (key, value) -> {
            if (StringUtils.hasText(key) && value != null) {
              merged.put(key, value);
            }
          });
      integration.setConfig(merged);
    }
    return IntegrationSummary.from(integrationRepository.save(integration));
  }

  /**
   * Runs a provider action on the owner's integration, refreshing tokens first when they are
   * about to expire.
   */
  public JsonNode execute(UUID ownerId, UUID integrationId, String action, JsonNode params) {
    Integration integration =
        integrationRepository
            .findByIdAndOwnerId(integrationId, ownerId)
            .orElseThrow(IntegrationException::notFound);
    ensureExecutable(integration);
    IntegrationProviderService provider = registry.get(integration.getProviderType());
    if (action == null || !provider.supportedActions().contains(action)) {
      throw IntegrationException.unsupportedAction(action);
    }

    ProviderTokens tokens = acquireTokens(integration, provider);
    JsonNode result;
    try {
      result = provider.execute(tokens, action, params);
    } catch (IntegrationException ex) {
      metrics.action(integration.getProviderType(), "failure");
      if (ex.code() == IntegrationErrorCode.UPSTREAM_ACTION_FAILED) {
        transition(integration, IntegrationStatus.ERROR);
      }
      throw ex;
    }
    if (integration.getStatus() == IntegrationStatus.ERROR) {
      transition(integration, IntegrationStatus.ACTIVE);
    }
    metrics.action(integration.getProviderType(), "success");
    return result;
  }

  private ProviderTokens acquireTokens(
      Integration integration, IntegrationProviderService provider) {
    try {
      return tokenService.acquireTokens(integration.getId(), provider);
    } catch (TokenDecryptionException ex) {
      log.warn(
          "Stored tokens of integration {} cannot be decrypted: {}",
          integration.getId(),
          ex.getMessage());
      transition(integration, IntegrationStatus.ERROR);
      throw new IntegrationException(IntegrationErrorCode.TOKEN_DECRYPTION_FAILED);
    } catch (TokenRefreshException ex) {
      if (ex.isTerminal()) {
        transition(integration, IntegrationStatus.EXPIRED);
      }
      throw ex;
    }
  }

  private void ensureExecutable(Integration integration) {
    if (integration.getStatus() == IntegrationStatus.EXPIRED) {
      throw new IntegrationException(IntegrationErrorCode.INTEGRATION_EXPIRED);
    }
    if (integration.getStatus() == IntegrationStatus.DISCONNECTED) {
      throw new IntegrationException(IntegrationErrorCode.INTEGRATION_INACTIVE);
    }
  }

  private void transition(Integration integration, IntegrationStatus status) {
    if (integrationRepository.updateStatus(integration.getId(), status, clock.instant()) > 0) {
      log.info(
          "Integration {} moved from {} to {}",
          integration.getId(),
          integration.getStatus().value(),
          status.value());
    }
  }

  private Integration loadOwned(UUID ownerId, UUID integrationId) {
    return integrationRepository
        .findByIdAndOwnerId(integrationId, ownerId)
        .orElseThrow(IntegrationException::notFound);
  }

  private void validateRedirectUri(String redirectUri) {
    if (!StringUtils.hasText(redirectUri) || redirectUri.trim().length() > MAX_REDIRECT_LENGTH) {
      throw IntegrationException.invalidParams("redirect_uri must be an absolute http(s) URL");
    }
    try {
      URI uri = URI.create(redirectUri.trim());
      String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
      if (!uri.isAbsolute()
          || uri.getHost() == null
          || !(scheme.equals("http") || scheme.equals("https"))) {
        throw IntegrationException.invalidParams("redirect_uri must be an absolute http(s) URL");
      }
    } catch (IllegalArgumentException ex) {
      throw IntegrationException.invalidParams("redirect_uri must be an absolute http(s) URL");
    }
  }
}
