package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.assignment.AssignmentEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AssignmentResponse {

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("escort_id")
    UUID escortId;

    @JsonProperty("position")
    int position;

    @JsonProperty("assigned_at")
    Instant assignedAt;

    @JsonProperty("released_at")
    Instant releasedAt;

    public static AssignmentResponse from(AssignmentEntity assignment) {
        return AssignmentResponse.builder()
            .orderId(assignment.getOrderId())
            .escortId(assignment.getEscortId())
            .position(assignment.getPosition())
            .assignedAt(assignment.getAssignedAt())
            .releasedAt(assignment.getReleasedAt())
            .build();
    }
}
