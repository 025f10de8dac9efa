package com.assistme.backend.integration.service;

import com.assistme.backend.integration.api.IntegrationSummary;

/**
 * Result of an authorization callback whose state was valid. The caller is always sent back to
 * {@code redirectUri}; either {@code integration} or {@code failure} is set.
 */
public record CallbackOutcome(
    String redirectUri, IntegrationSummary integration, IntegrationException failure) {

  public static CallbackOutcome success(String redirectUri, IntegrationSummary integration) {
    return new CallbackOutcome(redirectUri, integration, null);
  }

  public static CallbackOutcome failure(String redirectUri, IntegrationException failure) {
    return new CallbackOutcome(redirectUri, null, failure);
  }

  public boolean successful() {
    return failure == null;
  }
}
