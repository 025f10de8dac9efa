package com.assistme.backend.integration.service;

import org.springframework.http.HttpStatus;

public enum IntegrationErrorCode {
  UNKNOWN_PROVIDER(HttpStatus.BAD_REQUEST, "Unknown or unavailable provider"),
  INVALID_OR_EXPIRED_STATE(HttpStatus.BAD_REQUEST, "Invalid or expired authorization state"),
  TOKEN_EXCHANGE_FAILED(HttpStatus.BAD_GATEWAY, "Provider rejected the authorization code"),
  CONNECTION_NOT_STORED(
      HttpStatus.SERVICE_UNAVAILABLE, "Connection could not be stored, try again later"),
  TOKEN_DECRYPTION_FAILED(
      HttpStatus.UNAUTHORIZED, "Stored credentials are unreadable, reconnect required"),
  TOKEN_REFRESH_TRANSIENT(
      HttpStatus.SERVICE_UNAVAILABLE, "Provider is temporarily unavailable, try again later"),
  INTEGRATION_EXPIRED(HttpStatus.UNAUTHORIZED, "Integration expired, reconnect required"),
  UNSUPPORTED_ACTION(HttpStatus.BAD_REQUEST, "Unsupported action"),
  INVALID_PARAMS(HttpStatus.BAD_REQUEST, "Invalid action parameters"),
  UPSTREAM_ACTION_FAILED(HttpStatus.BAD_GATEWAY, "Provider request failed"),
  NOT_FOUND(HttpStatus.NOT_FOUND, "Integration not found"),
  INTEGRATION_INACTIVE(HttpStatus.CONFLICT, "Integration is not active"),
  INVALID_UPDATE(HttpStatus.BAD_REQUEST, "Invalid integration update"),
  PROVIDER_NOT_IMPLEMENTED(HttpStatus.NOT_IMPLEMENTED, "Provider not implemented");

  private final HttpStatus status;
  private final String defaultMessage;

  IntegrationErrorCode(HttpStatus status, String defaultMessage) {
    this.status = status;
    this.defaultMessage = defaultMessage;
  }

  public HttpStatus status() {
    return status;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
