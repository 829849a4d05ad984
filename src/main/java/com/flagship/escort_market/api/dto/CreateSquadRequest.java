package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateSquadRequest {

    @NotBlank(message = "Squad name is required")
    @Size(max = 100, message = "Squad name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("actor_id")
    UUID actorId;
}
