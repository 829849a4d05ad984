package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class GameAccountRequest {

    @NotBlank(message = "Game account id is required")
    @Size(max = 100, message = "Game account id must be at most 100 characters")
    @JsonProperty("game_account_id")
    String gameAccountId;
}
