package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * Body of commands that only carry who issued them.
 */
@Value
public class ActorRequest {

    @JsonProperty("actor_id")
    UUID actorId;
}
