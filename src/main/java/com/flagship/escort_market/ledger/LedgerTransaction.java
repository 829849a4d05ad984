package com.flagship.escort_market.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger entry. The sum of a user's transactions is the user's balance.
 */
@Value
public class LedgerTransaction {
    UUID id;
    UUID userId;
    long amount;
    TransactionType type;
    UUID referenceId;
    String description;
    Instant createdAt;

    public boolean isCredit() {
        return amount > 0;
    }
}
