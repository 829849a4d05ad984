package com.flagship.escort_market.complaint;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A complaint filed by a user, optionally about an order. Append-only.
 */
@Entity
@Table(
    name = "complaints",
    indexes = {
        @Index(name = "idx_complaints_user_id", columnList = "user_id"),
        @Index(name = "idx_complaints_order_id", columnList = "order_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ComplaintEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @Column(nullable = false, updatable = false, length = 4000)
    private String text;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static ComplaintEntity of(UUID userId, UUID orderId, String text, Instant now) {
        ComplaintEntity complaint = new ComplaintEntity();
        complaint.id = UUID.randomUUID();
        complaint.userId = userId;
        complaint.orderId = orderId;
        complaint.text = text;
        complaint.createdAt = now;
        return complaint;
    }
}
