package com.flagship.escort_market.order.event;

import com.flagship.escort_market.order.OrderStatus;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Asks the notifier to remind customer and executors of an order that has been
 * running for too long.
 */
@Value
public class OrderReminderEvent implements OrderEvent {
    UUID eventId;
    UUID orderId;
    String memoId;
    OrderStatus status;
    UUID customerId;
    List<UUID> executorIds;
    Instant orderCreatedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderReminder";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
