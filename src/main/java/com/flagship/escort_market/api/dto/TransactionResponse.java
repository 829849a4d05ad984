package com.flagship.escort_market.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escort_market.ledger.LedgerTransaction;
import com.flagship.escort_market.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .userId(tx.getUserId())
            .amount(tx.getAmount())
            .type(tx.getType())
            .referenceId(tx.getReferenceId())
            .description(tx.getDescription())
            .createdAt(tx.getCreatedAt())
            .build();
    }
}
