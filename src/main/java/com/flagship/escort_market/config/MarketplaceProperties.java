package com.flagship.escort_market.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Business settings of the marketplace core, bound from {@code marketplace.*}.
 */
@Data
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    private Commission commission = new Commission();
    private Assignment assignment = new Assignment();
    private Concurrency concurrency = new Concurrency();
    private Reminder reminder = new Reminder();

    @Data
    public static class Commission {
        /** {@code fixed} or {@code tiered}. */
        private String mode = "fixed";
        /** Platform share in basis points for the fixed mode. 2000 = 20%. */
        private int rateBasisPoints = 2000;
        /** Tiers for the tiered mode, matched by the highest threshold not above the order amount. */
        private List<Tier> tiers = new ArrayList<>();
    }

    @Data
    public static class Tier {
        private long minAmount;
        private int rateBasisPoints;
    }

    @Data
    public static class Assignment {
        /** {@code earliest} or {@code earliest-squad}. */
        private String policy = "earliest";
        private int maxApplications = 4;
        private int maxExecutors = 4;
        private int minSquadMembers = 2;
        /** Escorts without a game account may not apply. */
        private boolean requireGameAccount = true;
    }

    @Data
    public static class Concurrency {
        private int maxAttempts = 3;
        private long initialBackoffMs = 20;
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Reminder {
        private boolean enabled = true;
        private Duration staleAfter = Duration.ofHours(12);
        private long intervalMs = 600_000;
    }
}
