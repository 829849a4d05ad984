package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for orders.
 */
@Value
@Builder
public class OrderResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("memo_id")
    String memoId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("squad_id")
    UUID squadId;

    @JsonProperty("commission_amount")
    long commissionAmount;

    @JsonProperty("rating")
    Integer rating;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static OrderResponse from(Order order) {
        return OrderResponse.builder()
            .id(order.getId())
            .memoId(order.getMemoId())
            .customerId(order.getCustomerId())
            .description(order.getDescription())
            .amount(order.getAmount())
            .status(order.getStatus())
            .squadId(order.getSquadId())
            .commissionAmount(order.getCommissionAmount())
            .rating(order.getRating())
            .createdAt(order.getCreatedAt())
            .startedAt(order.getStartedAt())
            .finishedAt(order.getFinishedAt())
            .settledAt(order.getSettledAt())
            .build();
    }
}
