package com.flagship.escort_market.ledger.commission;

/**
 * Computes the platform's share of an order amount.
 *
 * Implementations must be deterministic and return a value in {@code [0, amount]}.
 */
public interface CommissionPolicy {

    long commissionFor(long amount);

    /**
     * Applies a rate in basis points to a non-negative amount, rounding down to
     * whole minor units. Split into quotient and remainder so it cannot overflow.
     */
    static long applyBasisPoints(long amount, int basisPoints) {
        return (amount / 10_000L) * basisPoints + (amount % 10_000L) * basisPoints / 10_000L;
    }
}
