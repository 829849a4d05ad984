package com.flagship.escort_market.command;

import com.flagship.escort_market.assignment.ApplicationEntity;
import com.flagship.escort_market.assignment.AssignmentService;
import com.flagship.escort_market.complaint.ComplaintEntity;
import com.flagship.escort_market.complaint.ComplaintService;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.escort.EscortService;
import com.flagship.escort_market.ledger.LedgerService;
import com.flagship.escort_market.ledger.LedgerTransaction;
import com.flagship.escort_market.observability.CorrelationContext;
import com.flagship.escort_market.order.CreateOrderResult;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderLifecycleService;
import com.flagship.escort_market.reputation.ReputationService;
import com.flagship.escort_market.settlement.Payout;
import com.flagship.escort_market.settlement.SettlementService;
import com.flagship.escort_market.squad.SquadEntity;
import com.flagship.escort_market.squad.SquadService;
import com.flagship.escort_market.user.UserEntity;
import com.flagship.escort_market.user.UserService;
import com.flagship.escort_market.withdrawal.WithdrawalEntity;
import com.flagship.escort_market.withdrawal.WithdrawalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for every state-changing command of the marketplace.
 *
 * Not transactional itself: each attempt made by {@link ConflictRetryExecutor}
 * runs the service call in a new transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketplaceCommandService {

    private final OrderLifecycleService orderLifecycle;
    private final AssignmentService assignmentService;
    private final SettlementService settlementService;
    private final WithdrawalService withdrawalService;
    private final LedgerService ledgerService;
    private final ReputationService reputationService;
    private final ComplaintService complaintService;
    private final UserService userService;
    private final EscortService escortService;
    private final SquadService squadService;
    private final ConflictRetryExecutor retryExecutor;

    // Orders

    public CreateOrderResult createOrder(String memoId, UUID customerId, long amount, String description) {
        return withUser(customerId, () -> retryExecutor.execute("create_order",
            () -> orderLifecycle.create(memoId, customerId, amount, description), true));
    }

    public ApplicationEntity applyToOrder(UUID orderId, UUID escortId) {
        return withOrder(orderId, () -> retryExecutor.execute("apply_to_order",
            () -> assignmentService.apply(orderId, escortId), true));
    }

    public Order assignOrder(UUID orderId, List<UUID> escortIds, UUID actorId) {
        return withOrder(orderId, () -> retryExecutor.execute("assign_order",
            () -> assignmentService.assign(orderId, escortIds, actorId), true));
    }

    public Order autoAssignOrder(UUID orderId, UUID actorId) {
        return withOrder(orderId, () -> retryExecutor.execute("auto_assign_order",
            () -> assignmentService.autoAssign(orderId, actorId), true));
    }

    public Order startOrder(UUID orderId, UUID actorId) {
        return withOrder(orderId, () -> retryExecutor.execute("start_order",
            () -> orderLifecycle.start(orderId, actorId)));
    }

    public Order completeOrder(UUID orderId, Integer rating, UUID actorId) {
        return withOrder(orderId, () -> retryExecutor.execute("complete_order",
            () -> orderLifecycle.complete(orderId, rating, actorId)));
    }

    public Order cancelOrder(UUID orderId, UUID actorId) {
        return withOrder(orderId, () -> retryExecutor.execute("cancel_order",
            () -> orderLifecycle.cancel(orderId, actorId)));
    }

    public Order rateOrder(UUID orderId, int score, UUID actorId) {
        return withOrder(orderId, () -> retryExecutor.execute("rate_order",
            () -> orderLifecycle.rate(orderId, score, actorId)));
    }

    public List<Payout> settleOrder(UUID orderId) {
        return withOrder(orderId, () -> retryExecutor.execute("settle_order",
            () -> settlementService.settleOrder(orderId), true));
    }

    // Money

    public WithdrawalEntity requestWithdrawal(UUID userId, long amount) {
        return withUser(userId, () -> retryExecutor.execute("request_withdrawal",
            () -> withdrawalService.request(userId, amount)));
    }

    public WithdrawalEntity resolveWithdrawal(UUID withdrawalId, boolean approve, UUID operatorId) {
        return retryExecutor.execute("resolve_withdrawal",
            () -> withdrawalService.resolve(withdrawalId, approve, operatorId));
    }

    public LedgerTransaction adjustBalance(UUID userId, long signedAmount, UUID operatorId, String reason) {
        return withUser(userId, () -> retryExecutor.execute("adjust_balance",
            () -> ledgerService.adjustBalance(userId, signedAmount, operatorId, reason)));
    }

    public LedgerTransaction zeroBalance(UUID userId, UUID operatorId) {
        return withUser(userId, () -> retryExecutor.execute("zero_balance",
            () -> ledgerService.zeroBalance(userId, operatorId)));
    }

    // Reputation

    public EscortEntity recordRating(UUID escortId, int score, UUID actorId) {
        return retryExecutor.execute("record_rating",
            () -> reputationService.recordRating(escortId, score, actorId));
    }

    public EscortEntity banWorker(UUID escortId, Instant until, UUID actorId) {
        return retryExecutor.execute("ban_worker", () -> reputationService.ban(escortId, until, actorId));
    }

    public EscortEntity banWorkerPermanently(UUID escortId, UUID actorId) {
        return retryExecutor.execute("ban_worker_permanently",
            () -> reputationService.banPermanently(escortId, actorId));
    }

    public EscortEntity restrictWorker(UUID escortId, Instant until, UUID actorId) {
        return retryExecutor.execute("restrict_worker", () -> reputationService.restrict(escortId, until, actorId));
    }

    public EscortEntity liftRestrictions(UUID escortId, UUID actorId) {
        return retryExecutor.execute("lift_restrictions", () -> reputationService.lift(escortId, actorId));
    }

    public ComplaintEntity fileComplaint(UUID userId, UUID orderId, String text) {
        return withUser(userId, () -> complaintService.fileComplaint(userId, orderId, text));
    }

    // Users, escorts and squads

    public UserEntity registerUser(long externalId, String displayName) {
        return retryExecutor.execute("register_user",
            () -> userService.registerUser(externalId, displayName), true);
    }

    public EscortEntity registerEscort(UUID userId) {
        return withUser(userId, () -> retryExecutor.execute("register_escort",
            () -> escortService.registerEscort(userId), true));
    }

    public EscortEntity setGameAccount(UUID escortId, String gameAccountId) {
        return retryExecutor.execute("set_game_account", () -> escortService.setGameAccount(escortId, gameAccountId));
    }

    public EscortEntity acceptRules(UUID escortId) {
        return retryExecutor.execute("accept_rules", () -> escortService.acceptRules(escortId));
    }

    public SquadEntity createSquad(String name, UUID actorId) {
        return retryExecutor.execute("create_squad", () -> squadService.createSquad(name, actorId), true);
    }

    public EscortEntity joinSquad(UUID escortId, UUID squadId) {
        return retryExecutor.execute("join_squad", () -> squadService.joinSquad(escortId, squadId));
    }

    public EscortEntity leaveSquad(UUID escortId) {
        return retryExecutor.execute("leave_squad", () -> squadService.leaveSquad(escortId));
    }

    public void disbandSquad(UUID squadId, UUID actorId) {
        retryExecutor.execute("disband_squad", () -> {
            squadService.disbandSquad(squadId, actorId);
            return null;
        });
    }

    private static <T> T withOrder(UUID orderId, Supplier<T> command) {
        CorrelationContext.putOrderId(orderId);
        try {
            return command.get();
        } finally {
            CorrelationContext.clearSubjects();
        }
    }

    private static <T> T withUser(UUID userId, Supplier<T> command) {
        CorrelationContext.putUserId(userId);
        try {
            return command.get();
        } finally {
            CorrelationContext.clearSubjects();
        }
    }
}
