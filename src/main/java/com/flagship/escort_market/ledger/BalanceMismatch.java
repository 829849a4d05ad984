package com.flagship.escort_market.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A user whose cached balance disagrees with the sum of their transactions.
 */
@Value
public class BalanceMismatch {
    UUID userId;
    long cachedBalance;
    long transactionSum;
}
