package com.assistme.backend.integration.provider;

/**
 * Upstream HTTP failure. Keeps the status and the OAuth {@code error} code of the response; the
 * response body itself is dropped.
 */
public class ProviderHttpException extends RuntimeException {

  private final int status;
  private final String errorCode;

  public ProviderHttpException(int status, String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
    this.errorCode = errorCode;
  }

  /** HTTP status, or 0 when no response was received. */
  public int status() {
    return status;
  }

  public String errorCode() {
    return errorCode;
  }

  public boolean isNetworkFailure() {
    return status == 0;
  }

  public boolean isServerError() {
    return status >= 500 || status == 429;
  }
}
