package com.assistme.backend.integration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "oauth_state")
public class OAuthStateRecord {

  @Id
  @Column(name = "state", nullable = false, length = 64)
  private String state;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider_type", nullable = false, length = 32)
  private ProviderType providerType;

  @Column(name = "redirect_uri", nullable = false, length = 512)
  private String redirectUri;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  protected OAuthStateRecord() {}

  public OAuthStateRecord(
      String state,
      UUID ownerId,
      ProviderType providerType,
      String redirectUri,
      Instant createdAt,
      Instant expiresAt) {
    this.state = state;
    this.ownerId = ownerId;
    this.providerType = providerType;
    this.redirectUri = redirectUri;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  public String getState() {
    return state;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public ProviderType getProviderType() {
    return providerType;
  }

  public String getRedirectUri() {
    return redirectUri;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getConsumedAt() {
    return consumedAt;
  }
}
