package com.flagship.escort_market.order.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per order, when its payouts were credited.
 */
@Value
public class OrderSettledEvent implements OrderEvent {
    UUID eventId;
    UUID orderId;
    long amount;
    long commission;
    List<PayoutLine> payouts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Value
    public static class PayoutLine {
        UUID escortId;
        UUID userId;
        long amount;
        long commission;
    }
}
