package com.flagship.escort_market.error;

import java.util.UUID;

public class NoSuchApplicationException extends MarketplaceException {

    public NoSuchApplicationException(UUID orderId, Object escortId) {
        super(ErrorCode.NO_SUCH_APPLICATION, String.format("No application from %s for order %s", escortId, orderId));
    }
}
