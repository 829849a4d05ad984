package com.flagship.escort_market.assignment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A worker's request to execute an order, with the squad and game account the
 * worker had when applying. Immutable.
 */
@Entity
@Table(
    name = "order_applications",
    uniqueConstraints = @UniqueConstraint(name = "uk_order_applications_order_escort",
        columnNames = {"order_id", "escort_id"}),
    indexes = @Index(name = "idx_order_applications_escort_id", columnList = "escort_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApplicationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "escort_id", nullable = false, updatable = false)
    private UUID escortId;

    @Column(name = "squad_id", updatable = false)
    private UUID squadId;

    @Column(name = "game_account_id", updatable = false, length = 100)
    private String gameAccountId;

    @Column(name = "applied_at", nullable = false, updatable = false)
    private Instant appliedAt;

    static ApplicationEntity of(UUID orderId, UUID escortId, UUID squadId, String gameAccountId, Instant now) {
        ApplicationEntity application = new ApplicationEntity();
        application.id = UUID.randomUUID();
        application.orderId = orderId;
        application.escortId = escortId;
        application.squadId = squadId;
        application.gameAccountId = gameAccountId;
        application.appliedAt = now;
        return application;
    }
}
