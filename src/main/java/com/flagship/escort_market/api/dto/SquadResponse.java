package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.squad.SquadEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SquadResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("rating")
    double rating;

    @JsonProperty("rating_count")
    int ratingCount;

    @JsonProperty("total_orders")
    long totalOrders;

    @JsonProperty("total_earnings")
    long totalEarnings;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SquadResponse from(SquadEntity squad) {
        return SquadResponse.builder()
            .id(squad.getId())
            .name(squad.getName())
            .rating(squad.getRating())
            .ratingCount(squad.getRatingCount())
            .totalOrders(squad.getTotalOrders())
            .totalEarnings(squad.getTotalEarnings())
            .createdAt(squad.getCreatedAt())
            .build();
    }
}
