package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Explicit executor choice. The first escort gets the first payout position.
 */
@Value
public class AssignOrderRequest {

    @NotEmpty(message = "At least one escort id is required")
    @JsonProperty("escort_ids")
    List<UUID> escortIds;

    @JsonProperty("actor_id")
    UUID actorId;
}
