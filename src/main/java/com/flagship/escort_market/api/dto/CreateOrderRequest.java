package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Request DTO for creating an order. {@code memo_id} makes the request idempotent.
 */
@Value
public class CreateOrderRequest {

    @NotBlank(message = "Memo id is required")
    @Size(max = 100, message = "Memo id must be at most 100 characters")
    @JsonProperty("memo_id")
    String memoId;

    @NotNull(message = "Customer id is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    @JsonProperty("description")
    String description;
}
