package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.user.UserEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class UserResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("external_id")
    long externalId;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("rating")
    double rating;

    @JsonProperty("worker")
    boolean worker;

    @JsonProperty("registered_at")
    Instant registeredAt;

    public static UserResponse from(UserEntity user) {
        return UserResponse.builder()
            .id(user.getId())
            .externalId(user.getExternalId())
            .displayName(user.getDisplayName())
            .balance(user.getBalance())
            .rating(user.getRating())
            .worker(user.isWorker())
            .registeredAt(user.getRegisteredAt())
            .build();
    }
}
