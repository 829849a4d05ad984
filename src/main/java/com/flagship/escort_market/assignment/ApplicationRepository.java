package com.flagship.escort_market.assignment;

import com.flagship.escort_market.order.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApplicationRepository extends JpaRepository<ApplicationEntity, UUID> {

    /**
     * Applications in the order they arrived; the id breaks ties of equal timestamps.
     */
    List<ApplicationEntity> findByOrderIdOrderByAppliedAtAscIdAsc(UUID orderId);

    Optional<ApplicationEntity> findByOrderIdAndEscortId(UUID orderId, UUID escortId);

    boolean existsByOrderIdAndEscortId(UUID orderId, UUID escortId);

    long countByOrderId(UUID orderId);

    /**
     * Whether an application snapshotted the squad on an order still in the given status.
     */
    @Query("""
        SELECT CASE WHEN COUNT(a) > 0 THEN true ELSE false END
        FROM ApplicationEntity a, OrderEntity o
        WHERE a.orderId = o.id AND a.squadId = :squadId AND o.status = :status
        """)
    boolean existsBySquadIdAndOrderStatus(@Param("squadId") UUID squadId, @Param("status") OrderStatus status);
}
