package com.flagship.escort_market.report;

import lombok.Value;

import java.time.Instant;

/**
 * Orders completed in [from, to) with their volume and the platform commission.
 */
@Value
public class PeriodReport {
    Instant from;
    Instant to;
    long completedOrders;
    long totalAmount;
    long totalCommission;
}
