package com.flagship.escort_market.order;

import lombok.Value;

/**
 * Outcome of an order submission: the order and whether this call created it.
 */
@Value
public class CreateOrderResult {
    Order order;
    boolean created;
}
