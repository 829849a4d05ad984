package com.flagship.escort_market.error;

import lombok.Getter;

/**
 * Base type for every business rule violation raised by the core.
 *
 * Subclasses are terminal for the command that raised them, except
 * {@link ConflictException}.
 */
@Getter
public abstract class MarketplaceException extends RuntimeException {

    private final ErrorCode code;

    protected MarketplaceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected MarketplaceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
