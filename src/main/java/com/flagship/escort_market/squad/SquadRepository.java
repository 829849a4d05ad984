package com.flagship.escort_market.squad;

import com.flagship.escort_market.config.LockHints;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SquadRepository extends JpaRepository<SquadEntity, UUID> {

    Optional<SquadEntity> findByName(String name);

    boolean existsByName(String name);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = LockHints.LOCK_TIMEOUT, value = LockHints.LOCK_TIMEOUT_MS))
    @Query("SELECT s FROM SquadEntity s WHERE s.id = :id")
    Optional<SquadEntity> findByIdForUpdate(@Param("id") UUID id);
}
