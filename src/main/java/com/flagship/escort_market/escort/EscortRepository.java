package com.flagship.escort_market.escort;

import com.flagship.escort_market.config.LockHints;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscortRepository extends JpaRepository<EscortEntity, UUID> {

    Optional<EscortEntity> findByUserId(UUID userId);

    @Query("SELECT e FROM EscortEntity e, UserEntity u WHERE e.userId = u.id AND u.externalId = :externalId")
    Optional<EscortEntity> findByUserExternalId(@Param("externalId") long externalId);

    List<EscortEntity> findBySquadIdOrderByRegisteredAtAsc(UUID squadId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = LockHints.LOCK_TIMEOUT, value = LockHints.LOCK_TIMEOUT_MS))
    @Query("SELECT e FROM EscortEntity e WHERE e.id = :id")
    Optional<EscortEntity> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = LockHints.LOCK_TIMEOUT, value = LockHints.LOCK_TIMEOUT_MS))
    @Query("SELECT e FROM EscortEntity e WHERE e.squadId = :squadId")
    List<EscortEntity> findBySquadIdForUpdate(@Param("squadId") UUID squadId);
}
