package com.assistme.backend.integration.persistence;

import com.assistme.backend.integration.domain.Integration;
import com.assistme.backend.integration.domain.IntegrationStatus;
import com.assistme.backend.integration.domain.ProviderType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface IntegrationRepository extends JpaRepository<Integration, UUID> {

  List<Integration> findByOwnerIdOrderByCreatedAtAsc(UUID ownerId);

  Optional<Integration> findByIdAndOwnerId(UUID id, UUID ownerId);

  Optional<Integration> findByOwnerIdAndProviderType(UUID ownerId, ProviderType providerType);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "update Integration i set i.status = :status, i.updatedAt = :now "
          + "where i.id = :id and i.status <> :status")
  int updateStatus(
      @Param("id") UUID id,
      @Param("status") IntegrationStatus status,
      @Param("now") Instant now);

  /**
   * Inserts the owner's integration for the provider or reactivates the existing row. Concurrent
   * callers for the same pair queue on the row instead of failing the unique constraint.
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          "insert into integration (id, owner_id, provider_type, status, created_at, updated_at) "
              + "values (:id, :ownerId, :providerType, :status, :now, :now) "
              + "on conflict (owner_id, provider_type) "
              + "do update set status = excluded.status, updated_at = excluded.updated_at",
      nativeQuery = true)
  int upsertStatus(
      @Param("id") UUID id,
      @Param("ownerId") UUID ownerId,
      @Param("providerType") String providerType,
      @Param("status") String status,
      @Param("now") Instant now);
}
