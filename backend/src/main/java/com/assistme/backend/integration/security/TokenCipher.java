package com.assistme.backend.integration.security;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.util.StringUtils;

/**
 * AES-256-GCM encryption of token material at rest.
 *
 * <p>Cipher text layout, base64url encoded without padding: one version byte, a 12 byte nonce,
 * then the encrypted payload followed by the 16 byte authentication tag. Any modification of the
 * cipher text, or a different key, makes {@link #decrypt(String)} fail.
 */
public class TokenCipher {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final byte VERSION = 1;
  private static final int NONCE_LENGTH = 12;
  private static final int TAG_LENGTH_BITS = 128;
  private static final int KEY_LENGTH = 32;
  private static final int MIN_LENGTH = 1 + NONCE_LENGTH + TAG_LENGTH_BITS / 8;

  private final SecretKey key;
  private final SecureRandom random;

  public TokenCipher(byte[] keyBytes) {
    this(keyBytes, new SecureRandom());
  }

  TokenCipher(byte[] keyBytes, SecureRandom random) {
    if (keyBytes == null || keyBytes.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Token encryption key must be 32 bytes");
    }
    this.key = new SecretKeySpec(keyBytes.clone(), "AES");
    this.random = random;
  }

  /** Builds a cipher from a base64 (standard or url-safe) encoded 256-bit key. */
  public static TokenCipher fromBase64Key(String encodedKey) {
    if (!StringUtils.hasText(encodedKey)) {
      throw new IllegalStateException("app.integrations.encryption-key is not configured");
    }
    byte[] keyBytes;
    try {
      String trimmed = encodedKey.trim();
      keyBytes =
          trimmed.indexOf('-') >= 0 || trimmed.indexOf('_') >= 0
              ? Base64.getUrlDecoder().decode(trimmed)
              : Base64.getDecoder().decode(trimmed);
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("app.integrations.encryption-key is not valid base64", ex);
    }
    return new TokenCipher(keyBytes);
  }

  public String encrypt(String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("plaintext must not be null");
    }
    byte[] nonce = new byte[NONCE_LENGTH];
    random.nextBytes(nonce);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
      cipher.updateAAD(new byte[] {VERSION});
      byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      ByteBuffer buffer = ByteBuffer.allocate(1 + NONCE_LENGTH + sealed.length);
      buffer.put(VERSION).put(nonce).put(sealed);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Token encryption failed", ex);
    }
  }

  public String decrypt(String ciphertext) {
    if (!StringUtils.hasText(ciphertext)) {
      throw new TokenDecryptionException("Cipher text is empty");
    }
    byte[] raw;
    try {
      raw = Base64.getUrlDecoder().decode(ciphertext.trim());
    } catch (IllegalArgumentException ex) {
      throw new TokenDecryptionException("Cipher text is not valid base64", ex);
    }
    if (raw.length < MIN_LENGTH) {
      throw new TokenDecryptionException("Cipher text is truncated");
    }
    if (raw[0] != VERSION) {
      throw new TokenDecryptionException("Unsupported cipher text version " + raw[0]);
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, raw, 1, NONCE_LENGTH));
      cipher.updateAAD(new byte[] {VERSION});
      byte[] plain = cipher.doFinal(raw, 1 + NONCE_LENGTH, raw.length - 1 - NONCE_LENGTH);
      return new String(plain, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException ex) {
      throw new TokenDecryptionException("Cipher text failed authentication", ex);
    }
  }
}
