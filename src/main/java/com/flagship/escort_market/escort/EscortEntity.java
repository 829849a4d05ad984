package com.flagship.escort_market.escort;

import com.flagship.escort_market.error.WorkerRestrictedException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Worker profile of a user. One per user; the escort's money lives on the user's balance.
 *
 * Ban and restriction windows are plain timestamps: a null or past value means
 * the window is not active. A permanent ban has no end.
 */
@Entity
@Table(
    name = "escorts",
    uniqueConstraints = @UniqueConstraint(name = "uk_escorts_user_id", columnNames = "user_id"),
    indexes = @Index(name = "idx_escorts_squad_id", columnList = "squad_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EscortEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "game_account_id", length = 100)
    private String gameAccountId;

    @Column(name = "squad_id")
    private UUID squadId;

    @Column(nullable = false)
    private double rating;

    @Column(name = "rating_count", nullable = false)
    private int ratingCount;

    @Column(name = "completed_orders", nullable = false)
    private int completedOrders;

    @Column(name = "ban_until")
    private Instant banUntil;

    @Column(name = "restrict_until")
    private Instant restrictUntil;

    @Column(name = "permanently_banned", nullable = false)
    private boolean permanentlyBanned;

    @Column(name = "rules_accepted", nullable = false)
    private boolean rulesAccepted;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Version
    private Long version;

    public static EscortEntity register(UUID userId, Instant now) {
        EscortEntity escort = new EscortEntity();
        escort.id = UUID.randomUUID();
        escort.userId = userId;
        escort.registeredAt = now;
        return escort;
    }

    public boolean isRestrictedAt(Instant now) {
        return permanentlyBanned || isAfter(banUntil, now) || isAfter(restrictUntil, now);
    }

    /**
     * @throws WorkerRestrictedException if a ban or restriction is active at {@code now}
     */
    public void ensureEligible(Instant now) {
        if (permanentlyBanned) {
            throw new WorkerRestrictedException(id, null);
        }
        Instant until = latestActive(now);
        if (until != null) {
            throw new WorkerRestrictedException(id, until);
        }
    }

    public void ban(Instant until) {
        this.banUntil = until;
    }

    public void banPermanently() {
        this.permanentlyBanned = true;
    }

    public void restrict(Instant until) {
        this.restrictUntil = until;
    }

    /**
     * Clears every ban and restriction, including a permanent ban.
     */
    public void lift() {
        this.banUntil = null;
        this.restrictUntil = null;
        this.permanentlyBanned = false;
    }

    public void joinSquad(UUID squadId) {
        this.squadId = squadId;
    }

    public void leaveSquad() {
        this.squadId = null;
    }

    public void setGameAccount(String gameAccountId) {
        this.gameAccountId = gameAccountId;
    }

    public void acceptRules() {
        this.rulesAccepted = true;
    }

    public void recordRating(int score) {
        this.rating = (rating * ratingCount + score) / (ratingCount + 1);
        this.ratingCount++;
    }

    public void incrementCompletedOrders() {
        this.completedOrders++;
    }

    private Instant latestActive(Instant now) {
        Instant ban = isAfter(banUntil, now) ? banUntil : null;
        Instant restriction = isAfter(restrictUntil, now) ? restrictUntil : null;
        if (ban == null) {
            return restriction;
        }
        if (restriction == null) {
            return ban;
        }
        return ban.isAfter(restriction) ? ban : restriction;
    }

    private static boolean isAfter(Instant until, Instant now) {
        return until != null && until.isAfter(now);
    }
}
