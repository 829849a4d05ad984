package com.flagship.escort_market.ledger.commission;

import com.flagship.escort_market.config.MarketplaceProperties;

import java.util.Comparator;
import java.util.List;

/**
 * Rate depends on the order amount: the tier with the highest {@code minAmount}
 * not above the amount applies. Amounts below every tier pay no commission.
 */
public class TieredCommissionPolicy implements CommissionPolicy {

    private final List<MarketplaceProperties.Tier> tiers;

    public TieredCommissionPolicy(List<MarketplaceProperties.Tier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Tiered commission requires at least one tier");
        }
        for (MarketplaceProperties.Tier tier : tiers) {
            if (tier.getRateBasisPoints() < 0 || tier.getRateBasisPoints() > 10_000) {
                throw new IllegalArgumentException("Tier rate must be within 0..10000 basis points: " + tier.getRateBasisPoints());
            }
        }
        this.tiers = tiers.stream()
            .sorted(Comparator.comparingLong(MarketplaceProperties.Tier::getMinAmount).reversed())
            .toList();
    }

    @Override
    public long commissionFor(long amount) {
        return tiers.stream()
            .filter(tier -> amount >= tier.getMinAmount())
            .findFirst()
            .map(tier -> CommissionPolicy.applyBasisPoints(amount, tier.getRateBasisPoints()))
            .orElse(0L);
    }

    @Override
    public String toString() {
        return "tiered" + tiers.stream().map(t -> t.getMinAmount() + ":" + t.getRateBasisPoints() + "bp").toList();
    }
}
