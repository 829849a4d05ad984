package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.ledger.BalanceMismatch;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class BalanceMismatchResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("cached_balance")
    long cachedBalance;

    @JsonProperty("transaction_sum")
    long transactionSum;

    public static BalanceMismatchResponse from(BalanceMismatch mismatch) {
        return BalanceMismatchResponse.builder()
            .userId(mismatch.getUserId())
            .cachedBalance(mismatch.getCachedBalance())
            .transactionSum(mismatch.getTransactionSum())
            .build();
    }
}
