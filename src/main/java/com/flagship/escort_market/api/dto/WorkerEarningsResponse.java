package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.report.WorkerEarnings;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class WorkerEarningsResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("orders")
    long orders;

    @JsonProperty("total_payout")
    long totalPayout;

    @JsonProperty("total_commission")
    long totalCommission;

    public static WorkerEarningsResponse from(WorkerEarnings earnings) {
        return WorkerEarningsResponse.builder()
            .userId(earnings.getUserId())
            .orders(earnings.getOrders())
            .totalPayout(earnings.getTotalPayout())
            .totalCommission(earnings.getTotalCommission())
            .build();
    }
}
