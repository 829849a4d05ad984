package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class JoinSquadRequest {

    @NotNull(message = "Squad id is required")
    @JsonProperty("squad_id")
    UUID squadId;
}
