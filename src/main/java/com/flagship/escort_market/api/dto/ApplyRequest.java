package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class ApplyRequest {

    @NotNull(message = "Escort id is required")
    @JsonProperty("escort_id")
    UUID escortId;
}
