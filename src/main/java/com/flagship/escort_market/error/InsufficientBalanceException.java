package com.flagship.escort_market.error;

import java.util.UUID;

public class InsufficientBalanceException extends MarketplaceException {

    public InsufficientBalanceException(UUID userId, long balance, long requested) {
        super(ErrorCode.INSUFFICIENT_BALANCE, String.format("User %s has balance %d, cannot take %d", userId, balance, requested));
    }
}
