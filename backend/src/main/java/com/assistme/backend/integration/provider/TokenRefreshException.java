package com.assistme.backend.integration.provider;

import com.assistme.backend.integration.service.IntegrationErrorCode;
import com.assistme.backend.integration.service.IntegrationException;

/**
 * Refresh failure. Terminal failures mean the refresh token was revoked or rejected and the
 * integration must be reconnected; the rest may succeed on a later attempt.
 */
public class TokenRefreshException extends IntegrationException {

  private final boolean terminal;

  private TokenRefreshException(
      IntegrationErrorCode code, boolean terminal, String message, Throwable cause) {
    super(code, message, cause);
    this.terminal = terminal;
  }

  public static TokenRefreshException terminal(String message) {
    return new TokenRefreshException(IntegrationErrorCode.INTEGRATION_EXPIRED, true, message, null);
  }

  public static TokenRefreshException transientFailure(String message, Throwable cause) {
    return new TokenRefreshException(
        IntegrationErrorCode.TOKEN_REFRESH_TRANSIENT, false, message, cause);
  }

  public boolean isTerminal() {
    return terminal;
  }
}
