package com.flagship.escort_market.user;

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
 * A marketplace participant, customer or worker, identified by the id of the
 * external messaging platform.
 *
 * {@code balance} is a cached projection of the user's ledger transactions.
 * It is only changed through {@link #applyLedgerEntry(long)}, which the ledger
 * calls in the same transaction that appends the matching transaction row.
 */
@Entity
@Table(
    name = "users",
    uniqueConstraints = @UniqueConstraint(name = "uk_users_external_id", columnNames = "external_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "external_id", nullable = false, updatable = false)
    private long externalId;

    @Column(name = "display_name")
    private String displayName;

    @Column(nullable = false)
    private long balance;

    @Column(nullable = false)
    private double rating;

    @Column(nullable = false)
    private boolean worker;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Version
    private Long version;

    public static UserEntity register(long externalId, String displayName, Instant now) {
        UserEntity user = new UserEntity();
        user.id = UUID.randomUUID();
        user.externalId = externalId;
        user.displayName = displayName;
        user.balance = 0;
        user.rating = 0.0;
        user.worker = false;
        user.registeredAt = now;
        return user;
    }

    public void applyLedgerEntry(long signedAmount) {
        long next = this.balance + signedAmount;
        if (next < 0) {
            throw new IllegalStateException(
                "Balance of user " + id + " would become negative: " + next);
        }
        this.balance = next;
    }

    public void markWorker() {
        this.worker = true;
    }

    public void rename(String displayName) {
        this.displayName = displayName;
    }

    public void updateRating(double rating) {
        this.rating = rating;
    }
}
