package com.flagship.escort_market.withdrawal;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.error.InsufficientBalanceException;
import com.flagship.escort_market.error.NotFoundException;
import com.flagship.escort_market.ledger.LedgerService;
import com.flagship.escort_market.ledger.TransactionType;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import com.flagship.escort_market.outbox.OutboxService;
import com.flagship.escort_market.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Withdrawal requests and their resolution by an operator.
 *
 * A request debits the amount right away (WITHDRAWAL_HOLD), so the balance can
 * never be promised twice. Requests of one user serialize on the user's row lock
 * taken by the debit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalService {

    private final WithdrawalRepository withdrawalRepository;
    private final LedgerService ledgerService;
    private final UserService userService;
    private final AuditLogService auditLog;
    private final OutboxService outboxService;
    private final MarketplaceMetrics metrics;
    private final Clock clock;

    /**
     * @throws InsufficientBalanceException if the amount exceeds the balance
     */
    @Transactional
    public WithdrawalEntity request(UUID userId, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Withdrawal amount must be positive, got " + amount);
        }
        Instant now = Instant.now(clock);
        UUID withdrawalId = UUID.randomUUID();
        try {
            ledgerService.debit(userId, amount, TransactionType.WITHDRAWAL_HOLD, withdrawalId,
                "Withdrawal hold");
        } catch (InsufficientBalanceException e) {
            metrics.recordWithdrawal("insufficient_balance");
            throw e;
        }

        WithdrawalEntity withdrawal = withdrawalRepository.save(
            WithdrawalEntity.pending(withdrawalId, userId, amount, now));

        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.WITHDRAWAL_REQUESTED)
            .actorId(userId)
            .subjectId(userId)
            .newStatus(WithdrawalStatus.PENDING.name())
            .description("Withdrawal " + withdrawalId + " of " + amount + " requested"));
        outboxService.saveEvent(WithdrawalEvent.AGGREGATE_TYPE, withdrawalId, WithdrawalEvent.REQUESTED,
            WithdrawalEvent.of(withdrawal, now));

        metrics.recordWithdrawal("requested");
        log.info("Withdrawal requested: withdrawalId={}, amount={}", withdrawalId, amount);
        return withdrawal;
    }

    /**
     * PENDING → APPROVED (money leaves the platform, no ledger change) or
     * PENDING → REJECTED (the held amount is credited back).
     */
    @Transactional
    public WithdrawalEntity resolve(UUID withdrawalId, boolean approve, UUID operatorId) {
        Instant now = Instant.now(clock);
        WithdrawalEntity withdrawal = withdrawalRepository.findByIdForUpdate(withdrawalId)
            .orElseThrow(() -> new NotFoundException("Withdrawal", withdrawalId));
        WithdrawalStatus previous = withdrawal.getStatus();
        withdrawal.resolve(approve, operatorId, now);

        if (!approve) {
            ledgerService.credit(withdrawal.getUserId(), withdrawal.getAmount(), TransactionType.WITHDRAWAL_REVERSAL,
                withdrawalId, "Withdrawal rejected");
        }

        auditLog.append(ActionLogEntry.builder()
            .actionType(approve ? ActionType.WITHDRAWAL_APPROVED : ActionType.WITHDRAWAL_REJECTED)
            .actorId(operatorId)
            .subjectId(withdrawal.getUserId())
            .previousStatus(previous.name())
            .newStatus(withdrawal.getStatus().name())
            .description("Withdrawal " + withdrawalId + " of " + withdrawal.getAmount()));
        outboxService.saveEvent(WithdrawalEvent.AGGREGATE_TYPE, withdrawalId, WithdrawalEvent.RESOLVED,
            WithdrawalEvent.of(withdrawal, now));

        metrics.recordWithdrawal(approve ? "approved" : "rejected");
        log.info("Withdrawal {} resolved: {}", withdrawalId, withdrawal.getStatus());
        return withdrawal;
    }

    @Transactional(readOnly = true)
    public WithdrawalEntity getWithdrawal(UUID withdrawalId) {
        return withdrawalRepository.findById(withdrawalId)
            .orElseThrow(() -> new NotFoundException("Withdrawal", withdrawalId));
    }

    @Transactional(readOnly = true)
    public List<WithdrawalEntity> getByUser(UUID userId) {
        userService.getUser(userId);
        return withdrawalRepository.findByUserIdOrderByRequestedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<WithdrawalEntity> getPending() {
        return withdrawalRepository.findByStatusOrderByRequestedAtAsc(WithdrawalStatus.PENDING);
    }
}
