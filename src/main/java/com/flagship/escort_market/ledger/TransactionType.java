package com.flagship.escort_market.ledger;

/**
 * Kind of a ledger transaction. The sign of the amount follows the type:
 * payouts, reversals and manual credits are positive, holds and manual debits negative.
 */
public enum TransactionType {
    ORDER_PAYOUT,
    WITHDRAWAL_HOLD,
    WITHDRAWAL_REVERSAL,
    MANUAL_CREDIT,
    MANUAL_DEBIT
}
