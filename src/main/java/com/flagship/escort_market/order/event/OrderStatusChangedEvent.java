package com.flagship.escort_market.order.event;

import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderStatus;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published on every lifecycle transition of an order, creation included
 * ({@code previousStatus} is null then).
 */
@Value
public class OrderStatusChangedEvent implements OrderEvent {
    UUID eventId;
    UUID orderId;
    String memoId;
    UUID customerId;
    OrderStatus previousStatus;
    OrderStatus newStatus;
    UUID actorId;
    List<UUID> executorIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderStatusChangedEvent of(Order order, OrderStatus previousStatus, UUID actorId,
                                             List<UUID> executorIds, Instant now) {
        return new OrderStatusChangedEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getMemoId(),
            order.getCustomerId(),
            previousStatus,
            order.getStatus(),
            actorId,
            List.copyOf(executorIds),
            now
        );
    }
}
