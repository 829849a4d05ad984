package com.flagship.escort_market.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, UUID> {

    List<PayoutEntity> findByOrderIdOrderByCreatedAtAscAmountDesc(UUID orderId);

    List<PayoutEntity> findByEscortIdOrderByCreatedAtDesc(UUID escortId);

    @Query("""
        SELECT COALESCE(SUM(p.amount), 0) FROM PayoutEntity p, OrderEntity o
        WHERE p.orderId = o.id AND o.squadId = :squadId
        """)
    long sumAmountBySquadId(@Param("squadId") UUID squadId);
}
