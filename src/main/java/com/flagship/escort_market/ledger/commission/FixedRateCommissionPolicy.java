package com.flagship.escort_market.ledger.commission;

/**
 * Same rate for every order.
 */
public class FixedRateCommissionPolicy implements CommissionPolicy {

    private final int rateBasisPoints;

    public FixedRateCommissionPolicy(int rateBasisPoints) {
        if (rateBasisPoints < 0 || rateBasisPoints > 10_000) {
            throw new IllegalArgumentException("Commission rate must be within 0..10000 basis points: " + rateBasisPoints);
        }
        this.rateBasisPoints = rateBasisPoints;
    }

    @Override
    public long commissionFor(long amount) {
        return CommissionPolicy.applyBasisPoints(amount, rateBasisPoints);
    }

    @Override
    public String toString() {
        return "fixed(" + rateBasisPoints + "bp)";
    }
}
