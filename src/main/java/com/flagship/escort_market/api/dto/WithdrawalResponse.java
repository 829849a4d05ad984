package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.withdrawal.WithdrawalEntity;
import com.flagship.escort_market.withdrawal.WithdrawalStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WithdrawalResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("status")
    WithdrawalStatus status;

    @JsonProperty("requested_at")
    Instant requestedAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("resolved_by")
    UUID resolvedBy;

    public static WithdrawalResponse from(WithdrawalEntity withdrawal) {
        return WithdrawalResponse.builder()
            .id(withdrawal.getId())
            .userId(withdrawal.getUserId())
            .amount(withdrawal.getAmount())
            .status(withdrawal.getStatus())
            .requestedAt(withdrawal.getRequestedAt())
            .processedAt(withdrawal.getProcessedAt())
            .resolvedBy(withdrawal.getResolvedBy())
            .build();
    }
}
