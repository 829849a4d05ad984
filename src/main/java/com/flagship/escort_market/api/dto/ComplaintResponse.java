package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.complaint.ComplaintEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ComplaintResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("text")
    String text;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ComplaintResponse from(ComplaintEntity complaint) {
        return ComplaintResponse.builder()
            .id(complaint.getId())
            .userId(complaint.getUserId())
            .orderId(complaint.getOrderId())
            .text(complaint.getText())
            .createdAt(complaint.getCreatedAt())
            .build();
    }
}
