package com.assistme.backend.integration.service;

import com.assistme.backend.integration.config.IntegrationProperties;
import com.assistme.backend.integration.domain.OAuthStateRecord;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.persistence.OAuthStateRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Short-lived, single-use authorization state. A record is valid for the configured TTL from its
 * creation and can be consumed once.
 */
@Service
public class OAuthStateStore {

  private static final int STATE_BYTES = 32;
  private static final int MAX_STATE_LENGTH = 64;

  private final OAuthStateRepository repository;
  private final Clock clock;
  private final Duration ttl;
  private final SecureRandom random = new SecureRandom();

  public OAuthStateStore(
      OAuthStateRepository repository, IntegrationProperties properties, Clock clock) {
    this.repository = repository;
    this.clock = clock;
    this.ttl = properties.getStateTtl() != null ? properties.getStateTtl() : Duration.ofMinutes(15);
  }

  /** Issues a new state token, replacing pending states of the same owner and provider. */
  @Transactional
  public String create(UUID ownerId, ProviderType providerType, String redirectUri) {
    repository.deletePending(ownerId, providerType);
    String state = newStateToken();
    Instant now = clock.instant();
    repository.save(
        new OAuthStateRecord(state, ownerId, providerType, redirectUri, now, now.plus(ttl)));
    return state;
  }

  /**
   * @throws IntegrationException {@code INVALID_OR_EXPIRED_STATE} when the token is unknown,
   *     expired or already consumed
   */
  @Transactional
  public OAuthStateRecord consume(String state) {
    if (!StringUtils.hasText(state) || state.length() > MAX_STATE_LENGTH) {
      throw invalidState();
    }
    if (repository.markConsumed(state, clock.instant()) != 1) {
      throw invalidState();
    }
    return repository.findById(state).orElseThrow(OAuthStateStore::invalidState);
  }

  @Transactional
  public int purgeExpired() {
    return repository.deleteExpired(clock.instant());
  }

  private String newStateToken() {
    byte[] bytes = new byte[STATE_BYTES];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private static IntegrationException invalidState() {
    return new IntegrationException(IntegrationErrorCode.INVALID_OR_EXPIRED_STATE);
  }
}
