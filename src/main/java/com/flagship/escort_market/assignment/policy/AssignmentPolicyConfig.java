package com.flagship.escort_market.assignment.policy;

import com.flagship.escort_market.config.MarketplaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the automatic assignment policy from {@code marketplace.assignment.policy}.
 */
@Configuration
@Slf4j
public class AssignmentPolicyConfig {

    @Bean
    public AssignmentPolicy assignmentPolicy(MarketplaceProperties properties) {
        MarketplaceProperties.Assignment assignment = properties.getAssignment();
        AssignmentPolicy policy = switch (assignment.getPolicy()) {
            case EarliestApplicationPolicy.NAME -> new EarliestApplicationPolicy();
            case EarliestSquadPolicy.NAME ->
                new EarliestSquadPolicy(assignment.getMinSquadMembers(), assignment.getMaxExecutors());
            default -> throw new IllegalStateException(
                "Unknown assignment policy: " + assignment.getPolicy() + " (expected earliest or earliest-squad)");
        };
        log.info("Assignment policy: {}", policy.name());
        return policy;
    }
}
