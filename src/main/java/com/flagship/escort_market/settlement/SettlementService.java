package com.flagship.escort_market.settlement;

import com.flagship.escort_market.assignment.AssignmentEntity;
import com.flagship.escort_market.assignment.AssignmentService;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.escort.EscortService;
import com.flagship.escort_market.ledger.LedgerService;
import com.flagship.escort_market.ledger.TransactionType;
import com.flagship.escort_market.ledger.commission.CommissionPolicy;
import com.flagship.escort_market.observability.CorrelationContext;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderPersistenceService;
import com.flagship.escort_market.order.event.OrderEvent;
import com.flagship.escort_market.order.event.OrderSettledEvent;
import com.flagship.escort_market.outbox.OutboxService;
import com.flagship.escort_market.squad.SquadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Settles completed orders: commission, payouts, executor credits and squad counters.
 *
 * Key principles:
 * - Everything happens in one transaction, under the order's row lock
 * - Idempotent: a settled order returns its existing payouts and credits nothing
 * - The unique (order, escort) payout constraint backs the settled check
 * - The OrderSettled event is written to the outbox in the same transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final OrderPersistenceService orderPersistence;
    private final AssignmentService assignmentService;
    private final EscortService escortService;
    private final SquadService squadService;
    private final LedgerService ledgerService;
    private final PayoutRepository payoutRepository;
    private final CommissionPolicy commissionPolicy;
    private final OutboxService outboxService;
    private final MarketplaceMetrics metrics;
    private final Clock clock;

    /**
     * Settles the order once.
     *
     * @return the order's payouts, in executor order
     * @throws com.flagship.escort_market.error.InvalidTransitionException if the order is not COMPLETED
     */
    @Transactional
    public List<Payout> settleOrder(UUID orderId) {
        long startTime = System.nanoTime();
        CorrelationContext.putOrderId(orderId);

        Order order = orderPersistence.lockOrder(orderId);
        if (order.isSettled()) {
            log.info("Order already settled at {}, returning existing payouts", order.getSettledAt());
            metrics.recordSettlementReplayed();
            return getPayouts(orderId);
        }

        Instant now = Instant.now(clock);
        long commission = commissionPolicy.commissionFor(order.getAmount());
        Order settled = order.settle(commission, now);

        List<AssignmentEntity> executors = assignmentService.getActiveAssignments(orderId);
        if (executors.isEmpty()) {
            throw new IllegalStateException("Completed order " + orderId + " has no active executors");
        }
        List<PayoutSplit.Share> shares = PayoutSplit.split(order.getAmount() - commission, commission, executors.size());

        List<Payout> payouts = new ArrayList<>();
        List<OrderSettledEvent.PayoutLine> lines = new ArrayList<>();
        Set<UUID> squads = new LinkedHashSet<>();
        if (order.getSquadId() != null) {
            squads.add(order.getSquadId());
        }

        for (int i = 0; i < executors.size(); i++) {
            UUID escortId = executors.get(i).getEscortId();
            PayoutSplit.Share share = shares.get(i);
            EscortEntity escort = escortService.lockEscort(escortId);

            Payout payout = new Payout(UUID.randomUUID(), orderId, escortId, share.getAmount(), share.getCommission(), now);
            payoutRepository.save(PayoutEntity.fromDomain(payout));
            if (share.getAmount() > 0) {
                ledgerService.credit(escort.getUserId(), share.getAmount(), TransactionType.ORDER_PAYOUT, orderId,
                    "Payout for order " + order.getMemoId());
            }
            escort.incrementCompletedOrders();

            payouts.add(payout);
            lines.add(new OrderSettledEvent.PayoutLine(escortId, escort.getUserId(), share.getAmount(), share.getCommission()));
        }

        orderPersistence.update(settled);
        squads.forEach(squadService::recomputeCounters);

        outboxService.saveEvent(OrderEvent.AGGREGATE_TYPE, orderId, OrderSettledEvent.EVENT_TYPE,
            new OrderSettledEvent(UUID.randomUUID(), orderId, order.getAmount(), commission, lines, now));

        Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
        metrics.recordSettlement(duration);
        log.info("Order settled: amount={}, commission={}, executors={}, duration={}ms",
                order.getAmount(), commission, executors.size(), duration.toMillis());
        return payouts;
    }

    @Transactional(readOnly = true)
    public List<Payout> getPayouts(UUID orderId) {
        return payoutRepository.findByOrderIdOrderByCreatedAtAscAmountDesc(orderId).stream()
            .map(PayoutEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean isSettled(UUID orderId) {
        return orderPersistence.getOrder(orderId).isSettled();
    }
}
