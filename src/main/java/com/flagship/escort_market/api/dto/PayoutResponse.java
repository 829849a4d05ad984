package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.settlement.Payout;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PayoutResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("escort_id")
    UUID escortId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("commission")
    long commission;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PayoutResponse from(Payout payout) {
        return PayoutResponse.builder()
            .id(payout.getId())
            .orderId(payout.getOrderId())
            .escortId(payout.getEscortId())
            .amount(payout.getAmount())
            .commission(payout.getCommission())
            .createdAt(payout.getCreatedAt())
            .build();
    }
}
