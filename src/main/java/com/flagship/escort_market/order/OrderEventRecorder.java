package com.flagship.escort_market.order;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import com.flagship.escort_market.order.event.OrderEvent;
import com.flagship.escort_market.order.event.OrderStatusChangedEvent;
import com.flagship.escort_market.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes the audit entry and the outbox event of an order transition, in the
 * transaction that made the transition.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventRecorder {

    private final AuditLogService auditLog;
    private final OutboxService outboxService;
    private final MarketplaceMetrics metrics;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordTransition(OrderStatus previousStatus, Order order, ActionType actionType,
                                 UUID actorId, List<UUID> executorIds, String description) {
        auditLog.append(ActionLogEntry.builder()
            .actionType(actionType)
            .actorId(actorId)
            .orderId(order.getId())
            .previousStatus(previousStatus != null ? previousStatus.name() : null)
            .newStatus(order.getStatus().name())
            .description(description));

        OrderStatusChangedEvent event = OrderStatusChangedEvent.of(
            order, previousStatus, actorId, executorIds, Instant.now(clock));
        outboxService.saveEvent(OrderEvent.AGGREGATE_TYPE, order.getId(), OrderStatusChangedEvent.EVENT_TYPE, event);

        metrics.recordTransition(order.getStatus().name());
        log.info("Order transition: {} -> {} ({})", previousStatus, order.getStatus(), actionType);
    }
}
