package com.flagship.escort_market.order;

import com.flagship.escort_market.assignment.AssignmentService;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.error.DuplicateOrderException;
import com.flagship.escort_market.observability.CorrelationContext;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import com.flagship.escort_market.reputation.ReputationService;
import com.flagship.escort_market.settlement.SettlementService;
import com.flagship.escort_market.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Top-level order state machine.
 *
 * Each transition locks the order, validates it against the current status, applies
 * its side effects and appends one audit entry plus one outbox event, all in a
 * single transaction. Assignment is delegated to {@link AssignmentService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLifecycleService {

    private final OrderPersistenceService orderPersistence;
    private final OrderIdempotencyService idempotencyService;
    private final OrderEventRecorder eventRecorder;
    private final AssignmentService assignmentService;
    private final SettlementService settlementService;
    private final ReputationService reputationService;
    private final UserService userService;
    private final MarketplaceMetrics metrics;
    private final Clock clock;

    /**
     * Creates an OPEN order, keyed by its memo id.
     *
     * A resubmission with the same memo id and the same customer, amount and
     * description returns the existing order.
     *
     * @throws DuplicateOrderException if the memo id belongs to an order with different content
     */
    @Transactional
    public CreateOrderResult create(String memoId, UUID customerId, long amount, String description) {
        Order candidate = Order.create(memoId, customerId, amount, description, Instant.now(clock));

        Optional<Order> existing = idempotencyService.findOrderId(memoId)
            .flatMap(orderPersistence::findById);
        if (existing.isEmpty()) {
            existing = orderPersistence.findByMemoId(memoId);
            existing.ifPresentOrElse(
                order -> idempotencyService.remember(memoId, order.getId()),
                () -> idempotencyService.forget(memoId));
        }
        if (existing.isPresent()) {
            Order order = existing.get();
            if (!sameContent(order, candidate)) {
                metrics.recordOrderCreated("duplicate");
                throw new DuplicateOrderException(memoId);
            }
            metrics.recordIdempotencyHit();
            log.info("Memo id {} already used, returning existing order {}", memoId, order.getId());
            return new CreateOrderResult(order, false);
        }
        metrics.recordIdempotencyMiss();

        userService.getUser(customerId);
        Order saved = orderPersistence.insert(candidate);
        CorrelationContext.putOrderId(saved.getId());
        eventRecorder.recordTransition(null, saved, ActionType.ORDER_CREATED, customerId, List.of(),
            "Order " + memoId + " created for " + amount);
        idempotencyService.remember(memoId, saved.getId());

        metrics.recordOrderCreated("created");
        return new CreateOrderResult(saved, true);
    }

    /**
     * ASSIGNED → IN_PROGRESS.
     */
    @Transactional
    public Order start(UUID orderId, UUID actorId) {
        Order order = orderPersistence.lockOrder(orderId);
        Order started = orderPersistence.update(order.start(Instant.now(clock)));
        eventRecorder.recordTransition(order.getStatus(), started, ActionType.ORDER_STARTED, actorId,
            assignmentService.getActiveExecutorIds(orderId), "Work started");
        return started;
    }

    /**
     * ASSIGNED or IN_PROGRESS → COMPLETED, then settles the order and applies the
     * optional rating to every executor, atomically.
     */
    @Transactional
    public Order complete(UUID orderId, Integer rating, UUID actorId) {
        Order order = orderPersistence.lockOrder(orderId);
        Order completed = orderPersistence.update(order.complete(rating, Instant.now(clock)));
        List<UUID> executors = assignmentService.getActiveExecutorIds(orderId);

        eventRecorder.recordTransition(order.getStatus(), completed, ActionType.ORDER_COMPLETED, actorId, executors,
            rating != null ? "Completed with rating " + rating : "Completed");

        settlementService.settleOrder(orderId);
        if (rating != null) {
            reputationService.rateExecutors(executors, completed.getSquadId(), rating);
        }
        return orderPersistence.lockOrder(orderId);
    }

    /**
     * OPEN or ASSIGNED → CANCELLED. Releases the assignments; no money moves.
     */
    @Transactional
    public Order cancel(UUID orderId, UUID actorId) {
        Order order = orderPersistence.lockOrder(orderId);
        Order cancelled = orderPersistence.update(order.cancel(Instant.now(clock)));
        List<UUID> released = assignmentService.releaseAssignments(orderId);
        eventRecorder.recordTransition(order.getStatus(), cancelled, ActionType.ORDER_CANCELLED, actorId, released,
            released.isEmpty() ? "Cancelled" : "Cancelled, released " + released.size() + " executor(s)");
        return cancelled;
    }

    /**
     * Rates a completed, not yet rated order and passes the score on to its executors.
     */
    @Transactional
    public Order rate(UUID orderId, int score, UUID actorId) {
        Order order = orderPersistence.lockOrder(orderId);
        Order rated = orderPersistence.update(order.rate(score));
        List<UUID> executors = assignmentService.getActiveExecutorIds(orderId);
        reputationService.rateExecutors(executors, rated.getSquadId(), score);
        eventRecorder.recordTransition(order.getStatus(), rated, ActionType.ORDER_RATED, actorId, executors,
            "Rated " + score);
        return rated;
    }

    private static boolean sameContent(Order existing, Order candidate) {
        return existing.getCustomerId().equals(candidate.getCustomerId())
            && existing.getAmount() == candidate.getAmount()
            && Objects.equals(existing.getDescription(), candidate.getDescription());
    }
}
