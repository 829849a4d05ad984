package com.flagship.escort_market.error;

public class InvalidTransitionException extends MarketplaceException {

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }

    public static InvalidTransitionException of(String aggregate, Object id, Object from, Object to) {
        return new InvalidTransitionException(
            String.format("Cannot move %s %s from %s to %s", aggregate, id, from, to));
    }
}
