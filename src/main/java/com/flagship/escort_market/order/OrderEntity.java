package com.flagship.escort_market.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for orders.
 *
 * No setters: state changes go through the {@link Order} state machine and are
 * copied over with {@link #updateFromDomain(Order)}. The memo id is unique, so a
 * retried submission can never create a second row.
 */
@Entity
@Table(
    name = "orders",
    uniqueConstraints = @UniqueConstraint(name = "uk_orders_memo_id", columnNames = "memo_id"),
    indexes = {
        @Index(name = "idx_orders_status", columnList = "status"),
        @Index(name = "idx_orders_customer_id", columnList = "customer_id"),
        @Index(name = "idx_orders_squad_id", columnList = "squad_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "memo_id", nullable = false, updatable = false, length = 100)
    private String memoId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(length = 2000, updatable = false)
    private String description;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "squad_id")
    private UUID squadId;

    @Column(name = "commission_amount", nullable = false)
    private long commissionAmount;

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Version
    private Long version;

    static OrderEntity fromDomain(Order order) {
        return new OrderEntity(
            order.getId(),
            order.getMemoId(),
            order.getCustomerId(),
            order.getDescription(),
            order.getAmount(),
            order.getStatus(),
            order.getSquadId(),
            order.getCommissionAmount(),
            order.getRating(),
            order.getCreatedAt(),
            order.getStartedAt(),
            order.getFinishedAt(),
            order.getSettledAt(),
            null
        );
    }

    public Order toDomain() {
        return Order.builder()
            .id(id)
            .memoId(memoId)
            .customerId(customerId)
            .description(description)
            .amount(amount)
            .status(status)
            .squadId(squadId)
            .commissionAmount(commissionAmount)
            .rating(rating)
            .createdAt(createdAt)
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .settledAt(settledAt)
            .build();
    }

    /**
     * Copies the mutable fields. Identity, memo id, customer, description, amount
     * and creation time never change.
     */
    void updateFromDomain(Order order) {
        if (!id.equals(order.getId())) {
            throw new IllegalArgumentException("Order " + order.getId() + " does not match entity " + id);
        }
        this.status = order.getStatus();
        this.squadId = order.getSquadId();
        this.commissionAmount = order.getCommissionAmount();
        this.rating = order.getRating();
        this.startedAt = order.getStartedAt();
        this.finishedAt = order.getFinishedAt();
        this.settledAt = order.getSettledAt();
    }
}
