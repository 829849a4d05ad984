package com.flagship.escort_market.withdrawal;

import com.flagship.escort_market.error.InvalidTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A payout request of a user. The amount is held from the balance when the
 * request is made; a rejection gives it back.
 */
@Entity
@Table(
    name = "withdrawals",
    indexes = {
        @Index(name = "idx_withdrawals_user_id", columnList = "user_id"),
        @Index(name = "idx_withdrawals_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WithdrawalEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WithdrawalStatus status;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Version
    private Long version;

    static WithdrawalEntity pending(UUID id, UUID userId, long amount, Instant now) {
        WithdrawalEntity withdrawal = new WithdrawalEntity();
        withdrawal.id = id;
        withdrawal.userId = userId;
        withdrawal.amount = amount;
        withdrawal.status = WithdrawalStatus.PENDING;
        withdrawal.requestedAt = now;
        return withdrawal;
    }

    /**
     * PENDING → APPROVED or REJECTED.
     */
    void resolve(boolean approve, UUID operatorId, Instant now) {
        WithdrawalStatus target = approve ? WithdrawalStatus.APPROVED : WithdrawalStatus.REJECTED;
        if (status != WithdrawalStatus.PENDING) {
            throw InvalidTransitionException.of("withdrawal", id, status, target);
        }
        this.status = target;
        this.resolvedBy = operatorId;
        this.processedAt = now;
    }
}
