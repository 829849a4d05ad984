package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class ComplaintRequest {

    @NotNull(message = "User id is required")
    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("order_id")
    UUID orderId;

    @NotBlank(message = "Complaint text is required")
    @Size(max = 4000, message = "Complaint text must be at most 4000 characters")
    @JsonProperty("text")
    String text;
}
