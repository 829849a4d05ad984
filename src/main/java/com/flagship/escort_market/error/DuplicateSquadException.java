package com.flagship.escort_market.error;

public class DuplicateSquadException extends MarketplaceException {

    public DuplicateSquadException(String name) {
        super(ErrorCode.DUPLICATE_SQUAD, "Squad already exists: " + name);
    }
}
