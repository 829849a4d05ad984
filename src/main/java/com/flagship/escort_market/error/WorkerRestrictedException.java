package com.flagship.escort_market.error;

import java.time.Instant;
import java.util.UUID;

/**
 * The escort is banned or restricted at the time of the request.
 * {@code until} is null for a permanent ban.
 */
public class WorkerRestrictedException extends MarketplaceException {

    public WorkerRestrictedException(UUID escortId, Instant until) {
        super(ErrorCode.WORKER_RESTRICTED, until == null
            ? "Escort " + escortId + " is banned permanently"
            : "Escort " + escortId + " is restricted until " + until);
    }
}
