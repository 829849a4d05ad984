package com.flagship.escort_market.error;

/**
 * A concurrent update won the race for the same aggregate, or the row lock
 * could not be taken in time. Safe to retry.
 */
public class ConflictException extends MarketplaceException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorCode.CONFLICT, message, cause);
    }
}
