package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Ban or restriction window. A missing or past {@code until} clears it.
 */
@Value
public class RestrictionRequest {

    @JsonProperty("until")
    Instant until;

    @JsonProperty("actor_id")
    UUID actorId;
}
