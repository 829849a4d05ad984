package com.flagship.escort_market.assignment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Binding of an order to one of its executors. Active while {@code releasedAt} is null;
 * cancelling the order releases it.
 */
@Entity
@Table(
    name = "order_assignments",
    uniqueConstraints = @UniqueConstraint(name = "uk_order_assignments_order_escort",
        columnNames = {"order_id", "escort_id"}),
    indexes = @Index(name = "idx_order_assignments_escort_id", columnList = "escort_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AssignmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "escort_id", nullable = false, updatable = false)
    private UUID escortId;

    /** Rank of the executor within its assignment, 0 first. */
    @Column(name = "executor_position", nullable = false, updatable = false)
    private int position;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private Instant assignedAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    static AssignmentEntity of(UUID orderId, UUID escortId, int position, Instant now) {
        AssignmentEntity assignment = new AssignmentEntity();
        assignment.id = UUID.randomUUID();
        assignment.orderId = orderId;
        assignment.escortId = escortId;
        assignment.position = position;
        assignment.assignedAt = now;
        return assignment;
    }

    public boolean isActive() {
        return releasedAt == null;
    }

    void release(Instant now) {
        if (releasedAt == null) {
            this.releasedAt = now;
        }
    }
}
