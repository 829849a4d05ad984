package com.flagship.escort_market.withdrawal;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbox payload for withdrawal requests and resolutions.
 */
@Value
public class WithdrawalEvent {
    UUID eventId;
    UUID withdrawalId;
    UUID userId;
    long amount;
    WithdrawalStatus status;
    UUID resolvedBy;
    Instant occurredAt;

    public static final String AGGREGATE_TYPE = "Withdrawal";
    public static final String REQUESTED = "WithdrawalRequested";
    public static final String RESOLVED = "WithdrawalResolved";

    static WithdrawalEvent of(WithdrawalEntity withdrawal, Instant now) {
        return new WithdrawalEvent(UUID.randomUUID(), withdrawal.getId(), withdrawal.getUserId(),
            withdrawal.getAmount(), withdrawal.getStatus(), withdrawal.getResolvedBy(), now);
    }
}
