package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.assignment.ApplicationEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ApplicationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("escort_id")
    UUID escortId;

    @JsonProperty("squad_id")
    UUID squadId;

    @JsonProperty("game_account_id")
    String gameAccountId;

    @JsonProperty("applied_at")
    Instant appliedAt;

    public static ApplicationResponse from(ApplicationEntity application) {
        return ApplicationResponse.builder()
            .id(application.getId())
            .orderId(application.getOrderId())
            .escortId(application.getEscortId())
            .squadId(application.getSquadId())
            .gameAccountId(application.getGameAccountId())
            .appliedAt(application.getAppliedAt())
            .build();
    }
}
