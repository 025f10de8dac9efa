package com.assistme.backend.integration.persistence;

import com.assistme.backend.integration.domain.Integration;
import com.assistme.backend.integration.domain.IntegrationToken;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IntegrationTokenRepository extends JpaRepository<IntegrationToken, UUID> {

  Optional<IntegrationToken> findByIntegration(Integration integration);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select t from IntegrationToken t where t.integration.id = :integrationId")
  Optional<IntegrationToken> findByIntegrationIdForUpdate(
      @Param("integrationId") UUID integrationId);

  @Modifying
  @Query("delete from IntegrationToken t where t.integration = :integration")
  int deleteByIntegration(@Param("integration") Integration integration);
}
