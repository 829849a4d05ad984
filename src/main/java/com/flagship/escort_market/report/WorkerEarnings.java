package com.flagship.escort_market.report;

import lombok.Value;

import java.util.UUID;

@Value
public class WorkerEarnings {
    UUID userId;
    long orders;
    long totalPayout;
    long totalCommission;
}
