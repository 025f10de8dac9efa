package com.assistme.backend.integration.provider;

import java.time.Instant;
import java.util.List;

/** Decrypted tokens of one integration. Lives only for the duration of a single call. */
public record ProviderTokens(
    String accessToken, String refreshToken, Instant expiresAt, List<String> scopes) {

  public ProviderTokens {
    scopes = scopes != null ? List.copyOf(scopes) : List.of();
  }

  @Override
  public String toString() {
    return "ProviderTokens[expiresAt=" + expiresAt + ", scopes=" + scopes + "]";
  }
}
