package com.flagship.escort_market.error;

import java.util.UUID;

public class ApplicationLimitReachedException extends MarketplaceException {

    public ApplicationLimitReachedException(UUID orderId, int limit) {
        super(ErrorCode.APPLICATION_LIMIT_REACHED, String.format("Order %s already has %d applications", orderId, limit));
    }
}
