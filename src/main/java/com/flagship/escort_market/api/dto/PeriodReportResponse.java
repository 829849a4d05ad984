package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.report.PeriodReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PeriodReportResponse {

    @JsonProperty("from")
    Instant from;

    @JsonProperty("to")
    Instant to;

    @JsonProperty("completed_orders")
    long completedOrders;

    @JsonProperty("total_amount")
    long totalAmount;

    @JsonProperty("total_commission")
    long totalCommission;

    public static PeriodReportResponse from(PeriodReport report) {
        return PeriodReportResponse.builder()
            .from(report.getFrom())
            .to(report.getTo())
            .completedOrders(report.getCompletedOrders())
            .totalAmount(report.getTotalAmount())
            .totalCommission(report.getTotalCommission())
            .build();
    }
}
