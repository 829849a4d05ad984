package com.flagship.escort_market.error;

import java.util.UUID;

public class AlreadyAssignedException extends MarketplaceException {

    public AlreadyAssignedException(UUID orderId) {
        super(ErrorCode.ALREADY_ASSIGNED, "Order " + orderId + " already has executors");
    }
}
