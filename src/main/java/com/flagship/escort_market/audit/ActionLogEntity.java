package com.flagship.escort_market.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the action log. Rows are inserted once and never updated,
 * so every column is {@code updatable = false}.
 */
@Entity
@Table(
    name = "action_log",
    indexes = {
        @Index(name = "idx_action_log_order_id", columnList = "order_id"),
        @Index(name = "idx_action_log_actor_id", columnList = "actor_id"),
        @Index(name = "idx_action_log_subject_id", columnList = "subject_id"),
        @Index(name = "idx_action_log_created_at", columnList = "created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActionLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, updatable = false, length = 40)
    private ActionType actionType;

    @Column(name = "actor_id", updatable = false)
    private UUID actorId;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @Column(name = "subject_id", updatable = false)
    private UUID subjectId;

    @Column(name = "previous_status", updatable = false, length = 20)
    private String previousStatus;

    @Column(name = "new_status", updatable = false, length = 20)
    private String newStatus;

    @Column(name = "description", updatable = false, length = 1000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static ActionLogEntity fromDomain(ActionLogEntry entry) {
        return new ActionLogEntity(
            entry.getId(),
            entry.getActionType(),
            entry.getActorId(),
            entry.getOrderId(),
            entry.getSubjectId(),
            entry.getPreviousStatus(),
            entry.getNewStatus(),
            entry.getDescription(),
            entry.getCreatedAt()
        );
    }

    public ActionLogEntry toDomain() {
        return ActionLogEntry.builder()
            .id(id)
            .actionType(actionType)
            .actorId(actorId)
            .orderId(orderId)
            .subjectId(subjectId)
            .previousStatus(previousStatus)
            .newStatus(newStatus)
            .description(description)
            .createdAt(createdAt)
            .build();
    }
}
