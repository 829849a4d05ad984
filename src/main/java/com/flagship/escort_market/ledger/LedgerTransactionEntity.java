package com.flagship.escort_market.ledger;

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
 * JPA entity for ledger transactions.
 *
 * Rows are immutable once written: no setters, every column {@code updatable = false}.
 * Corrections are made by appending a compensating transaction.
 */
@Entity
@Table(
    name = "ledger_transactions",
    indexes = {
        @Index(name = "idx_ledger_transactions_user_id", columnList = "user_id"),
        @Index(name = "idx_ledger_transactions_reference_id", columnList = "reference_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private TransactionType type;

    @Column(name = "reference_id", updatable = false)
    private UUID referenceId;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LedgerTransactionEntity fromDomain(LedgerTransaction tx) {
        return new LedgerTransactionEntity(
            tx.getId(),
            tx.getUserId(),
            tx.getAmount(),
            tx.getType(),
            tx.getReferenceId(),
            tx.getDescription(),
            tx.getCreatedAt()
        );
    }

    public LedgerTransaction toDomain() {
        return new LedgerTransaction(id, userId, amount, type, referenceId, description, createdAt);
    }
}
