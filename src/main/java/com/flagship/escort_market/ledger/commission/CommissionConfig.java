package com.flagship.escort_market.ledger.commission;

import com.flagship.escort_market.config.MarketplaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the commission policy from {@code marketplace.commission.mode}.
 */
@Configuration
@Slf4j
public class CommissionConfig {

    @Bean
    public CommissionPolicy commissionPolicy(MarketplaceProperties properties) {
        MarketplaceProperties.Commission commission = properties.getCommission();
        CommissionPolicy policy = switch (commission.getMode()) {
            case "fixed" -> new FixedRateCommissionPolicy(commission.getRateBasisPoints());
            case "tiered" -> new TieredCommissionPolicy(commission.getTiers());
            default -> throw new IllegalStateException(
                "Unknown commission mode: " + commission.getMode() + " (expected fixed or tiered)");
        };
        log.info("Commission policy: {}", policy);
        return policy;
    }
}
