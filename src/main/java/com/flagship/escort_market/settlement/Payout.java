package com.flagship.escort_market.settlement;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Amount credited to an executor for an order, with the commission withheld from its share.
 */
@Value
public class Payout {
    UUID id;
    UUID orderId;
    UUID escortId;
    long amount;
    long commission;
    Instant createdAt;
}
