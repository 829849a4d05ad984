package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Operator correction. Positive amounts credit the user, negative ones debit.
 */
@Value
public class AdjustBalanceRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;

    @JsonProperty("operator_id")
    UUID operatorId;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
