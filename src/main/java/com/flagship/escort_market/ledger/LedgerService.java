package com.flagship.escort_market.ledger;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.error.InsufficientBalanceException;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import com.flagship.escort_market.user.UserEntity;
import com.flagship.escort_market.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Posts credits and debits to user balances.
 *
 * This service enforces the core invariants:
 * 1. A user's balance always equals the sum of their transactions
 * 2. Transactions are immutable once written
 * 3. A debit never takes a balance below zero
 *
 * Every posting locks the user row first, appends the transaction and updates the
 * cached balance in the same database transaction. Two concurrent debits of one
 * user are serialized by that lock, the second one sees the reduced balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerTransactionRepository transactionRepository;
    private final UserService userService;
    private final AuditLogService auditLog;
    private final JdbcTemplate jdbcTemplate;
    private final MarketplaceMetrics metrics;
    private final Clock clock;

    /**
     * Credits a positive amount to the user.
     *
     * @throws IllegalArgumentException if amount is not positive
     */
    @Transactional
    public LedgerTransaction credit(UUID userId, long amount, TransactionType type,
                                    UUID referenceId, String description) {
        requirePositive(amount);
        UserEntity user = userService.lockUser(userId);
        return post(user, amount, type, referenceId, description);
    }

    /**
     * Debits a positive amount from the user.
     *
     * @throws InsufficientBalanceException if the balance would become negative
     */
    @Transactional
    public LedgerTransaction debit(UUID userId, long amount, TransactionType type,
                                   UUID referenceId, String description) {
        requirePositive(amount);
        UserEntity user = userService.lockUser(userId);
        if (user.getBalance() < amount) {
            metrics.recordLedgerRejected(type);
            throw new InsufficientBalanceException(userId, user.getBalance(), amount);
        }
        return post(user, -amount, type, referenceId, description);
    }

    /**
     * Operator correction of a balance. Positive amounts are posted as
     * {@link TransactionType#MANUAL_CREDIT}, negative ones as {@link TransactionType#MANUAL_DEBIT}.
     */
    @Transactional
    public LedgerTransaction adjustBalance(UUID userId, long signedAmount, UUID operatorId, String reason) {
        if (signedAmount == 0) {
            throw new IllegalArgumentException("Adjustment amount must not be zero");
        }
        LedgerTransaction tx = signedAmount > 0
            ? credit(userId, signedAmount, TransactionType.MANUAL_CREDIT, null, reason)
            : debit(userId, -signedAmount, TransactionType.MANUAL_DEBIT, null, reason);

        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.BALANCE_ADJUSTED)
            .actorId(operatorId)
            .subjectId(userId)
            .description("Balance adjusted by " + signedAmount + (reason != null ? ": " + reason : "")));
        return tx;
    }

    /**
     * Debits the whole balance of the user. Returns null when the balance already is zero.
     */
    @Transactional
    public LedgerTransaction zeroBalance(UUID userId, UUID operatorId) {
        UserEntity user = userService.lockUser(userId);
        long balance = user.getBalance();
        if (balance == 0) {
            log.info("Balance of user {} already zero", userId);
            return null;
        }
        LedgerTransaction tx = post(user, -balance, TransactionType.MANUAL_DEBIT, null, "Balance zeroed");
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.BALANCE_ZEROED)
            .actorId(operatorId)
            .subjectId(userId)
            .description("Balance of " + balance + " zeroed"));
        return tx;
    }

    @Transactional(readOnly = true)
    public long getBalance(UUID userId) {
        return userService.getUser(userId).getBalance();
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactions(UUID userId) {
        userService.getUser(userId);
        return transactionRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
            .map(LedgerTransactionEntity::toDomain)
            .toList();
    }

    /**
     * Lists users whose cached balance differs from the sum of their transactions.
     * An empty list means the ledger is consistent.
     */
    @Transactional(readOnly = true)
    public List<BalanceMismatch> verifyBalances() {
        List<BalanceMismatch> mismatches = jdbcTemplate.query(
            "SELECT u.id, u.balance, COALESCE(SUM(t.amount), 0) AS transaction_sum " +
            "FROM users u LEFT JOIN ledger_transactions t ON t.user_id = u.id " +
            "GROUP BY u.id, u.balance " +
            "HAVING u.balance <> COALESCE(SUM(t.amount), 0)",
            balanceMismatchRowMapper()
        );
        if (!mismatches.isEmpty()) {
            log.error("Ledger inconsistency detected for {} users: {}", mismatches.size(), mismatches);
        }
        return mismatches;
    }

    private LedgerTransaction post(UserEntity user, long signedAmount, TransactionType type,
                                   UUID referenceId, String description) {
        LedgerTransaction tx = new LedgerTransaction(
            UUID.randomUUID(),
            user.getId(),
            signedAmount,
            type,
            referenceId,
            description,
            Instant.now(clock)
        );
        transactionRepository.save(LedgerTransactionEntity.fromDomain(tx));
        user.applyLedgerEntry(signedAmount);

        metrics.recordLedgerPosted(type, signedAmount);
        log.debug("Posted {} of {} to user {}, balance now {}",
                type, signedAmount, user.getId(), user.getBalance());
        return tx;
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }

    private RowMapper<BalanceMismatch> balanceMismatchRowMapper() {
        return (rs, rowNum) -> new BalanceMismatch(
            rs.getObject("id", UUID.class),
            rs.getLong("balance"),
            rs.getLong("transaction_sum")
        );
    }
}
