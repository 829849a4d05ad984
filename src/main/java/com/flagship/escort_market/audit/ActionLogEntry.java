package com.flagship.escort_market.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One append-only record of a successful state change.
 *
 * {@code actorId} is who issued the command (null for the system),
 * {@code subjectId} the user, escort or squad the change is about.
 * Status fields are filled for order and withdrawal transitions only.
 */
@Value
@Builder
public class ActionLogEntry {
    UUID id;
    ActionType actionType;
    UUID actorId;
    UUID orderId;
    UUID subjectId;
    String previousStatus;
    String newStatus;
    String description;
    Instant createdAt;
}
