package com.flagship.escort_market.squad;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A named group of escorts.
 *
 * {@code totalOrders} and {@code totalEarnings} are projections of settled orders and
 * their payouts. They are only written by {@link #applyCounters(long, long)}, from values
 * recomputed inside the settlement transaction.
 */
@Entity
@Table(
    name = "squads",
    uniqueConstraints = @UniqueConstraint(name = "uk_squads_name", columnNames = "name")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SquadEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false)
    private double rating;

    @Column(name = "rating_count", nullable = false)
    private int ratingCount;

    @Column(name = "total_orders", nullable = false)
    private long totalOrders;

    @Column(name = "total_earnings", nullable = false)
    private long totalEarnings;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public static SquadEntity create(String name, Instant now) {
        SquadEntity squad = new SquadEntity();
        squad.id = UUID.randomUUID();
        squad.name = name;
        squad.createdAt = now;
        return squad;
    }

    public void recordRating(int score) {
        this.rating = (rating * ratingCount + score) / (ratingCount + 1);
        this.ratingCount++;
    }

    void applyCounters(long totalOrders, long totalEarnings) {
        this.totalOrders = totalOrders;
        this.totalEarnings = totalEarnings;
    }
}
