package com.assistme.backend.integration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(
    name = "integration",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_integration_owner_provider",
            columnNames = {"owner_id", "provider_type"}))
public class Integration {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider_type", nullable = false, length = 32)
  private ProviderType providerType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private IntegrationStatus status = IntegrationStatus.ACTIVE;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "config", columnDefinition = "jsonb")
  private Map<String, Object> config = new LinkedHashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Integration() {}

  public Integration(UUID ownerId, ProviderType providerType) {
    this.ownerId = ownerId;
    this.providerType = providerType;
  }

  @PrePersist
  void onPersist() {
    Instant now = Instant.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public ProviderType getProviderType() {
    return providerType;
  }

  public IntegrationStatus getStatus() {
    return status;
  }

  public void setStatus(IntegrationStatus status) {
    this.status = status;
  }

  public Map<String, Object> getConfig() {
    return config != null ? config : Map.of();
  }

  public void setConfig(Map<String, Object> config) {
    this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
