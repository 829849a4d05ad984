package com.flagship.escort_market.order;

import com.flagship.escort_market.config.LockHints;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, UUID> {

    Optional<OrderEntity> findByMemoId(String memoId);

    List<OrderEntity> findByStatusOrderByCreatedAtAsc(OrderStatus status);

    /**
     * Loads the order with a row lock. Every state transition of an order starts here,
     * which makes concurrent transitions of one order run one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = LockHints.LOCK_TIMEOUT, value = LockHints.LOCK_TIMEOUT_MS))
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :id")
    Optional<OrderEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT o FROM OrderEntity o
        WHERE o.status IN :statuses AND o.createdAt < :createdBefore
        ORDER BY o.createdAt ASC
        """)
    List<OrderEntity> findStale(@Param("statuses") Collection<OrderStatus> statuses,
                                @Param("createdBefore") Instant createdBefore);

    boolean existsBySquadId(UUID squadId);

    long countBySquadIdAndSettledAtIsNotNull(UUID squadId);
}
