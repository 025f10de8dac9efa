package com.assistme.backend.integration.service;

import com.assistme.backend.integration.domain.Integration;
import com.assistme.backend.integration.domain.IntegrationStatus;
import com.assistme.backend.integration.domain.IntegrationToken;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.persistence.IntegrationRepository;
import com.assistme.backend.integration.persistence.IntegrationTokenRepository;
import com.assistme.backend.integration.provider.IntegrationProviderService;
import com.assistme.backend.integration.provider.ProviderTokens;
import com.assistme.backend.integration.provider.TokenBundle;
import com.assistme.backend.integration.provider.TokenRefreshException;
import com.assistme.backend.integration.security.TokenCipher;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional side of the integration lifecycle: stores encrypted token bundles and serializes
 * refreshes per integration through a row lock on its token.
 */
@Service
public class IntegrationTokenService {

  private static final Logger log = LoggerFactory.getLogger(IntegrationTokenService.class);

  private final IntegrationRepository integrationRepository;
  private final IntegrationTokenRepository tokenRepository;
  private final TokenCipher tokenCipher;
  private final IntegrationMetrics metrics;
  private final Clock clock;

  public IntegrationTokenService(
      IntegrationRepository integrationRepository,
      IntegrationTokenRepository tokenRepository,
      TokenCipher tokenCipher,
      IntegrationMetrics metrics,
      Clock clock) {
    this.integrationRepository = integrationRepository;
    this.tokenRepository = tokenRepository;
    this.tokenCipher = tokenCipher;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Upserts the owner's integration for the provider and writes the full token bundle. The upsert
   * holds the integration row until commit, so concurrent callbacks for the same pair store their
   * tokens one after another.
   */
  @Transactional
  public Integration storeConnection(UUID ownerId, ProviderType providerType, TokenBundle bundle) {
    integrationRepository.upsertStatus(
        UUID.randomUUID(),
        ownerId,
        providerType.name(),
        IntegrationStatus.ACTIVE.name(),
        clock.instant());
    Integration saved =
        integrationRepository
            .findByOwnerIdAndProviderType(ownerId, providerType)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Integration " + providerType.id() + " missing after upsert"));

    IntegrationToken token =
        tokenRepository.findByIntegration(saved).orElseGet(() -> new IntegrationToken(saved));
    writeBundle(token, bundle, clock.instant());
    tokenRepository.save(token);
    return saved;
  }

  /**
   * Returns usable tokens for the integration, refreshing them first when the provider asks for
   * it. The token row stays locked from read to write so concurrent callers refresh at most once
   * and never overwrite a newer refresh token with an older one. A transient refresh failure is
   * retried once.
   *
   * @throws com.assistme.backend.integration.security.TokenDecryptionException when stored cipher
   *     text cannot be decrypted
   * @throws TokenRefreshException when the refresh fails
   */
  @Transactional
  public ProviderTokens acquireTokens(UUID integrationId, IntegrationProviderService provider) {
    IntegrationToken token =
        tokenRepository
            .findByIntegrationIdForUpdate(integrationId)
            .orElseThrow(
                () ->
                    new IntegrationException(
                        IntegrationErrorCode.INTEGRATION_INACTIVE,
                        "Integration has no stored credentials, reconnect required"));
    ProviderTokens current = decrypt(token);
    Instant now = clock.instant();
    if (!provider.needsRefresh(current, now)) {
      return current;
    }

    TokenBundle refreshed = refreshWithRetry(integrationId, provider, current);
    writeBundle(token, refreshed, now);
    tokenRepository.save(token);
    metrics.tokenRefresh("success");
    log.info("Refreshed tokens of integration {}", integrationId);
    return new ProviderTokens(
        refreshed.accessToken(),
        refreshed.refreshToken() != null ? refreshed.refreshToken() : current.refreshToken(),
        token.getExpiresAt(),
        token.getScopes());
  }

  @Transactional
  public void revokeTokens(Integration integration) {
    int deleted = tokenRepository.deleteByIntegration(integration);
    log.debug("Deleted {} token rows of integration {}", deleted, integration.getId());
  }

  private TokenBundle refreshWithRetry(
      UUID integrationId, IntegrationProviderService provider, ProviderTokens current) {
    try {
      return provider.refresh(current);
    } catch (TokenRefreshException ex) {
      if (ex.isTerminal()) {
        metrics.tokenRefresh("terminal");
        throw ex;
      }
      log.info("Retrying token refresh of integration {} after transient failure", integrationId);
    }
    try {
      return provider.refresh(current);
    } catch (TokenRefreshException ex) {
      metrics.tokenRefresh(ex.isTerminal() ? "terminal" : "transient");
      throw ex;
    }
  }

  private ProviderTokens decrypt(IntegrationToken token) {
    String accessToken = tokenCipher.decrypt(token.getAccessToken());
    String refreshToken =
        token.getRefreshToken() != null ? tokenCipher.decrypt(token.getRefreshToken()) : null;
    return new ProviderTokens(accessToken, refreshToken, token.getExpiresAt(), token.getScopes());
  }

  /** A bundle without a refresh token or scopes keeps the stored ones. */
  private void writeBundle(IntegrationToken token, TokenBundle bundle, Instant now) {
    token.setAccessToken(tokenCipher.encrypt(bundle.accessToken()));
    if (bundle.refreshToken() != null) {
      token.setRefreshToken(tokenCipher.encrypt(bundle.refreshToken()));
    }
    if (!bundle.scopes().isEmpty()) {
      token.setScopes(bundle.scopes());
    }
    token.setTokenType(bundle.tokenType());
    token.setExpiresAt(bundle.expiresAt(now));
  }
}
