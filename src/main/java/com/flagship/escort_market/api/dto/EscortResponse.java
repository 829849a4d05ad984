package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.escort.EscortEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EscortResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("game_account_id")
    String gameAccountId;

    @JsonProperty("squad_id")
    UUID squadId;

    @JsonProperty("rating")
    double rating;

    @JsonProperty("rating_count")
    int ratingCount;

    @JsonProperty("completed_orders")
    int completedOrders;

    @JsonProperty("ban_until")
    Instant banUntil;

    @JsonProperty("restrict_until")
    Instant restrictUntil;

    @JsonProperty("permanently_banned")
    boolean permanentlyBanned;

    @JsonProperty("rules_accepted")
    boolean rulesAccepted;

    @JsonProperty("registered_at")
    Instant registeredAt;

    public static EscortResponse from(EscortEntity escort) {
        return EscortResponse.builder()
            .id(escort.getId())
            .userId(escort.getUserId())
            .gameAccountId(escort.getGameAccountId())
            .squadId(escort.getSquadId())
            .rating(escort.getRating())
            .ratingCount(escort.getRatingCount())
            .completedOrders(escort.getCompletedOrders())
            .banUntil(escort.getBanUntil())
            .restrictUntil(escort.getRestrictUntil())
            .permanentlyBanned(escort.isPermanentlyBanned())
            .rulesAccepted(escort.isRulesAccepted())
            .registeredAt(escort.getRegisteredAt())
            .build();
    }
}
