package com.flagship.escort_market.error;

import java.util.UUID;

public class DuplicateApplicationException extends MarketplaceException {

    public DuplicateApplicationException(UUID orderId, UUID escortId) {
        super(ErrorCode.DUPLICATE_APPLICATION, String.format("Escort %s already applied to order %s", escortId, orderId));
    }
}
