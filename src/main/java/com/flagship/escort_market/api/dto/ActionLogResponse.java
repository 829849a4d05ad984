package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ActionLogResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("action_type")
    ActionType actionType;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("subject_id")
    UUID subjectId;

    @JsonProperty("previous_status")
    String previousStatus;

    @JsonProperty("new_status")
    String newStatus;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ActionLogResponse from(ActionLogEntry entry) {
        return ActionLogResponse.builder()
            .id(entry.getId())
            .actionType(entry.getActionType())
            .actorId(entry.getActorId())
            .orderId(entry.getOrderId())
            .subjectId(entry.getSubjectId())
            .previousStatus(entry.getPreviousStatus())
            .newStatus(entry.getNewStatus())
            .description(entry.getDescription())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
