package com.flagship.escort_market.order.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for order events written to the outbox.
 */
public interface OrderEvent {

    String AGGREGATE_TYPE = "Order";

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getOrderId();

    Instant getOccurredAt();

    String getEventType();
}
