package com.flagship.escort_market.error;

import java.util.UUID;

public class OrderNotOpenException extends MarketplaceException {

    public OrderNotOpenException(UUID orderId, Object status) {
        super(ErrorCode.ORDER_NOT_OPEN, String.format("Order %s is %s, not OPEN", orderId, status));
    }
}
