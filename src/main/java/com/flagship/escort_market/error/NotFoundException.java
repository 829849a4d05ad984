package com.flagship.escort_market.error;

public class NotFoundException extends MarketplaceException {

    public NotFoundException(String entity, Object id) {
        super(ErrorCode.NOT_FOUND, entity + " not found: " + id);
    }
}
