package com.flagship.escort_market.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable payout row. Unique per (order, escort): a second settlement of the
 * same order fails on this constraint even if the application check were bypassed.
 */
@Entity
@Table(
    name = "payouts",
    uniqueConstraints = @UniqueConstraint(name = "uk_payouts_order_escort", columnNames = {"order_id", "escort_id"}),
    indexes = @Index(name = "idx_payouts_escort_id", columnList = "escort_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoutEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "escort_id", nullable = false, updatable = false)
    private UUID escortId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(nullable = false, updatable = false)
    private long commission;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static PayoutEntity fromDomain(Payout payout) {
        return new PayoutEntity(
            payout.getId(),
            payout.getOrderId(),
            payout.getEscortId(),
            payout.getAmount(),
            payout.getCommission(),
            payout.getCreatedAt()
        );
    }

    public Payout toDomain() {
        return new Payout(id, orderId, escortId, amount, commission, createdAt);
    }
}
