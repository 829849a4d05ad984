package com.flagship.escort_market.order;

import com.flagship.escort_market.error.AlreadyAssignedException;
import com.flagship.escort_market.error.InvalidTransitionException;
import com.flagship.escort_market.error.OrderNotOpenException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Order domain object with an explicit state machine.
 *
 * Transitions return a new instance; invalid transitions throw and leave the
 * order untouched.
 */
@Value
@Builder(toBuilder = true)
public class Order {
    UUID id;
    String memoId;
    UUID customerId;
    String description;
    long amount;
    OrderStatus status;
    UUID squadId;
    long commissionAmount;
    Integer rating;
    Instant createdAt;
    Instant startedAt;
    Instant finishedAt;
    Instant settledAt;

    public static Order create(String memoId, UUID customerId, long amount, String description, Instant now) {
        if (memoId == null || memoId.isBlank()) {
            throw new IllegalArgumentException("Memo id is required");
        }
        if (customerId == null) {
            throw new IllegalArgumentException("Customer id is required");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Order amount must be positive, got " + amount);
        }
        return Order.builder()
            .id(UUID.randomUUID())
            .memoId(memoId)
            .customerId(customerId)
            .description(description)
            .amount(amount)
            .status(OrderStatus.OPEN)
            .createdAt(now)
            .build();
    }

    /**
     * Checks that executors may be bound to this order.
     *
     * @throws AlreadyAssignedException if the order already has executors
     * @throws OrderNotOpenException if the order is terminal
     */
    public void ensureAssignable() {
        switch (status) {
            case OPEN -> { }
            case ASSIGNED, IN_PROGRESS -> throw new AlreadyAssignedException(id);
            default -> throw new OrderNotOpenException(id, status);
        }
    }

    /**
     * OPEN → ASSIGNED. {@code squadId} is null when the executors do not share one squad.
     */
    public Order assign(UUID squadId) {
        ensureAssignable();
        return toBuilder().status(OrderStatus.ASSIGNED).squadId(squadId).build();
    }

    /**
     * ASSIGNED → IN_PROGRESS.
     */
    public Order start(Instant now) {
        ensureTransition(OrderStatus.IN_PROGRESS);
        return toBuilder().status(OrderStatus.IN_PROGRESS).startedAt(now).build();
    }

    /**
     * ASSIGNED or IN_PROGRESS → COMPLETED.
     */
    public Order complete(Integer score, Instant now) {
        ensureTransition(OrderStatus.COMPLETED);
        if (score != null) {
            validateScore(score);
        }
        return toBuilder().status(OrderStatus.COMPLETED).rating(score).finishedAt(now).build();
    }

    /**
     * OPEN or ASSIGNED → CANCELLED.
     */
    public Order cancel(Instant now) {
        ensureTransition(OrderStatus.CANCELLED);
        return toBuilder().status(OrderStatus.CANCELLED).finishedAt(now).build();
    }

    /**
     * Rates a completed order. An order is rated once.
     */
    public Order rate(int score) {
        validateScore(score);
        if (status != OrderStatus.COMPLETED) {
            throw new InvalidTransitionException("Order " + id + " is " + status + " and cannot be rated");
        }
        if (rating != null) {
            throw new InvalidTransitionException("Order " + id + " is already rated");
        }
        return toBuilder().rating(score).build();
    }

    /**
     * Records the settlement. Only a completed, unsettled order can be settled.
     */
    public Order settle(long commission, Instant now) {
        if (status != OrderStatus.COMPLETED) {
            throw new InvalidTransitionException("Order " + id + " is " + status + ", only COMPLETED orders are settled");
        }
        if (isSettled()) {
            throw new IllegalStateException("Order " + id + " is already settled");
        }
        if (commission < 0 || commission > amount) {
            throw new IllegalArgumentException("Commission " + commission + " outside of [0, " + amount + "]");
        }
        return toBuilder().commissionAmount(commission).settledAt(now).build();
    }

    public boolean isSettled() {
        return settledAt != null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canTransitionTo(OrderStatus target) {
        return switch (status) {
            case OPEN -> target == OrderStatus.ASSIGNED || target == OrderStatus.CANCELLED;
            case ASSIGNED -> target == OrderStatus.IN_PROGRESS || target == OrderStatus.COMPLETED
                || target == OrderStatus.CANCELLED;
            case IN_PROGRESS -> target == OrderStatus.COMPLETED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    private void ensureTransition(OrderStatus target) {
        if (!canTransitionTo(target)) {
            throw InvalidTransitionException.of("order", id, status, target);
        }
    }

    private static void validateScore(int score) {
        if (score < 1 || score > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got " + score);
        }
    }
}
