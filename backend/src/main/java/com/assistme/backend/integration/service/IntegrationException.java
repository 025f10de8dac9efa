package com.assistme.backend.integration.service;

/**
 * Failure of an integration operation. The message is safe to show to callers: it never carries
 * tokens, upstream payloads or stack traces.
 */
public class IntegrationException extends RuntimeException {

  private final IntegrationErrorCode code;

  public IntegrationException(IntegrationErrorCode code) {
    this(code, code.defaultMessage(), null);
  }

  public IntegrationException(IntegrationErrorCode code, String message) {
    this(code, message, null);
  }

  public IntegrationException(IntegrationErrorCode code, String message, Throwable cause) {
    super(message != null ? message : code.defaultMessage(), cause);
    this.code = code;
  }

  public IntegrationErrorCode code() {
    return code;
  }

  public static IntegrationException unknownProvider(String providerType) {
    return new IntegrationException(
        IntegrationErrorCode.UNKNOWN_PROVIDER, "Unknown provider: " + providerType);
  }

  public static IntegrationException notFound() {
    return new IntegrationException(IntegrationErrorCode.NOT_FOUND);
  }

  public static IntegrationException invalidParams(String message) {
    return new IntegrationException(IntegrationErrorCode.INVALID_PARAMS, message);
  }

  public static IntegrationException unsupportedAction(String action) {
    return new IntegrationException(
        IntegrationErrorCode.UNSUPPORTED_ACTION, "Unsupported action: " + action);
  }
}
