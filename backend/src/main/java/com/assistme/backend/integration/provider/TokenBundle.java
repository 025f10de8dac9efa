package com.assistme.backend.integration.provider;

import java.time.Instant;
import java.util.List;

/** Token set returned by a provider's token endpoint. {@code refreshToken} is absent unless rotated. */
public record TokenBundle(
    String accessToken,
    String refreshToken,
    String tokenType,
    Long expiresIn,
    List<String> scopes) {

  public TokenBundle {
    scopes = scopes != null ? List.copyOf(scopes) : List.of();
  }

  public Instant expiresAt(Instant now) {
    return expiresIn != null ? now.plusSeconds(expiresIn) : null;
  }
}
