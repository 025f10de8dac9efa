package com.assistme.backend.integration.persistence;

import com.assistme.backend.integration.domain.OAuthStateRecord;
import com.assistme.backend.integration.domain.ProviderType;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OAuthStateRepository extends JpaRepository<OAuthStateRecord, String> {

  /**
   * Marks a state as consumed. The row is only touched while it is unconsumed and unexpired, so of
   * several concurrent callers at most one gets an update count of 1.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "update OAuthStateRecord s set s.consumedAt = :now "
          + "where s.state = :state and s.consumedAt is null and s.expiresAt > :now")
  int markConsumed(@Param("state") String state, @Param("now") Instant now);

  @Modifying
  @Query(
      "delete from OAuthStateRecord s "
          + "where s.ownerId = :ownerId and s.providerType = :providerType and s.consumedAt is null")
  int deletePending(
      @Param("ownerId") UUID ownerId, @Param("providerType") ProviderType providerType);

  @Modifying
  @Query("delete from OAuthStateRecord s where s.expiresAt <= :cutoff")
  int deleteExpired(@Param("cutoff") Instant cutoff);
}
