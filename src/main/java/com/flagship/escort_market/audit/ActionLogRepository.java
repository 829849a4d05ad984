package com.flagship.escort_market.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ActionLogRepository extends JpaRepository<ActionLogEntity, UUID> {

    List<ActionLogEntity> findByOrderIdOrderByCreatedAtDesc(UUID orderId);

    @Query("""
        SELECT a FROM ActionLogEntity a
        WHERE a.actorId = :userId OR a.subjectId = :userId
        ORDER BY a.createdAt DESC
        """)
    List<ActionLogEntity> findByUser(@Param("userId") UUID userId);

    boolean existsByOrderIdAndActionTypeAndCreatedAtAfter(UUID orderId, ActionType actionType, Instant after);
}
