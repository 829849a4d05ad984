package com.flagship.escort_market.withdrawal;

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
public interface WithdrawalRepository extends JpaRepository<WithdrawalEntity, UUID> {

    List<WithdrawalEntity> findByUserIdOrderByRequestedAtDesc(UUID userId);

    List<WithdrawalEntity> findByStatusOrderByRequestedAtAsc(WithdrawalStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = LockHints.LOCK_TIMEOUT, value = LockHints.LOCK_TIMEOUT_MS))
    @Query("SELECT w FROM WithdrawalEntity w WHERE w.id = :id")
    Optional<WithdrawalEntity> findByIdForUpdate(@Param("id") UUID id);
}
