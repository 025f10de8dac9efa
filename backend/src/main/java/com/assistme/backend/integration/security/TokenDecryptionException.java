package com.assistme.backend.integration.security;

public class TokenDecryptionException extends RuntimeException {

  public TokenDecryptionException(String message) {
    super(message);
  }

  public TokenDecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
