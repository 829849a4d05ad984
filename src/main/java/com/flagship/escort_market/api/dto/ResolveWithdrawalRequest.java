package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class ResolveWithdrawalRequest {

    @NotNull(message = "Decision is required")
    @JsonProperty("approve")
    Boolean approve;

    @JsonProperty("operator_id")
    UUID operatorId;
}
