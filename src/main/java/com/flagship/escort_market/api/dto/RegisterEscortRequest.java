package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class RegisterEscortRequest {

    @NotNull(message = "User id is required")
    @JsonProperty("user_id")
    UUID userId;
}
