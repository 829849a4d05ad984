package com.flagship.escort_market.error;

import java.util.UUID;

/**
 * The escort has not set a game account and may not apply to orders yet.
 */
public class GameAccountRequiredException extends MarketplaceException {

    public GameAccountRequiredException(UUID escortId) {
        super(ErrorCode.GAME_ACCOUNT_REQUIRED, "Escort " + escortId + " has no game account set");
    }
}
