package com.flagship.escort_market.order;

import com.flagship.escort_market.assignment.AssignmentService;
import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.config.MarketplaceProperties;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import com.flagship.escort_market.order.event.OrderEvent;
import com.flagship.escort_market.order.event.OrderReminderEvent;
import com.flagship.escort_market.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Flags orders that have been assigned or in progress for longer than the
 * configured staleness window. An order is reminded at most once per window.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StaleOrderReminderService {

    private static final EnumSet<OrderStatus> RUNNING = EnumSet.of(OrderStatus.ASSIGNED, OrderStatus.IN_PROGRESS);

    private final OrderPersistenceService orderPersistence;
    private final AssignmentService assignmentService;
    private final AuditLogService auditLog;
    private final OutboxService outboxService;
    private final MarketplaceProperties properties;
    private final MarketplaceMetrics metrics;
    private final Clock clock;

    /**
     * @return number of reminders written
     */
    @Transactional
    public int remindStaleOrders() {
        Instant now = Instant.now(clock);
        Duration staleAfter = properties.getReminder().getStaleAfter();
        Instant threshold = now.minus(staleAfter);

        int reminded = 0;
        for (Order order : orderPersistence.findStale(RUNNING, threshold)) {
            if (auditLog.hasEntrySince(order.getId(), ActionType.REMINDER_SENT, threshold)) {
                continue;
            }
            List<UUID> executors = assignmentService.getActiveExecutorIds(order.getId());
            auditLog.append(ActionLogEntry.builder()
                .actionType(ActionType.REMINDER_SENT)
                .orderId(order.getId())
                .subjectId(order.getCustomerId())
                .newStatus(order.getStatus().name())
                .description("Order running since " + order.getCreatedAt()));
            outboxService.saveEvent(OrderEvent.AGGREGATE_TYPE, order.getId(), OrderReminderEvent.EVENT_TYPE,
                new OrderReminderEvent(UUID.randomUUID(), order.getId(), order.getMemoId(), order.getStatus(),
                    order.getCustomerId(), executors, order.getCreatedAt(), now));
            metrics.recordReminderSent();
            reminded++;
        }
        if (reminded > 0) {
            log.info("Sent {} stale order reminders (older than {})", reminded, staleAfter);
        }
        return reminded;
    }
}
