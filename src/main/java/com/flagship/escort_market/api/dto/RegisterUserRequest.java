package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterUserRequest {

    @NotNull(message = "External id is required")
    @JsonProperty("external_id")
    Long externalId;

    @Size(max = 255, message = "Display name must be at most 255 characters")
    @JsonProperty("display_name")
    String displayName;
}
