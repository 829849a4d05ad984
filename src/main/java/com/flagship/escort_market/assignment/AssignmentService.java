package com.flagship.escort_market.assignment;

import com.flagship.escort_market.assignment.policy.AssignmentPolicy;
import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.config.MarketplaceProperties;
import com.flagship.escort_market.error.ApplicationLimitReachedException;
import com.flagship.escort_market.error.DuplicateApplicationException;
import com.flagship.escort_market.error.GameAccountRequiredException;
import com.flagship.escort_market.error.NoSuchApplicationException;
import com.flagship.escort_market.error.OrderNotOpenException;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.escort.EscortService;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderEventRecorder;
import com.flagship.escort_market.order.OrderPersistenceService;
import com.flagship.escort_market.order.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Applications and assignments of orders.
 *
 * Every operation starts by locking the order row, so applications and
 * assignments of one order never interleave: of two concurrent assign calls the
 * second one sees the order ASSIGNED and fails with AlreadyAssigned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentService {

    private final ApplicationRepository applicationRepository;
    private final AssignmentRepository assignmentRepository;
    private final OrderPersistenceService orderPersistence;
    private final OrderEventRecorder eventRecorder;
    private final EscortService escortService;
    private final AssignmentPolicy assignmentPolicy;
    private final AuditLogService auditLog;
    private final MarketplaceProperties properties;
    private final MarketplaceMetrics metrics;
    private final Clock clock;

    /**
     * Records the escort's application with its current squad and game account.
     *
     * @throws OrderNotOpenException unless the order is OPEN
     * @throws com.flagship.escort_market.error.WorkerRestrictedException if the escort is banned or restricted
     * @throws GameAccountRequiredException if game accounts are required and the escort has none
     * @throws DuplicateApplicationException if the escort already applied
     * @throws ApplicationLimitReachedException if the order holds the maximum number of applications
     */
    @Transactional
    public ApplicationEntity apply(UUID orderId, UUID escortId) {
        Instant now = Instant.now(clock);
        Order order = orderPersistence.lockOrder(orderId);
        if (order.getStatus() != OrderStatus.OPEN) {
            metrics.recordApplication("order_not_open");
            throw new OrderNotOpenException(orderId, order.getStatus());
        }

        EscortEntity escort = escortService.lockEscort(escortId);
        escort.ensureEligible(now);
        if (properties.getAssignment().isRequireGameAccount() && escort.getGameAccountId() == null) {
            metrics.recordApplication("no_game_account");
            throw new GameAccountRequiredException(escortId);
        }

        if (applicationRepository.existsByOrderIdAndEscortId(orderId, escortId)) {
            metrics.recordApplication("duplicate");
            throw new DuplicateApplicationException(orderId, escortId);
        }
        int limit = properties.getAssignment().getMaxApplications();
        if (applicationRepository.countByOrderId(orderId) >= limit) {
            metrics.recordApplication("limit_reached");
            throw new ApplicationLimitReachedException(orderId, limit);
        }

        ApplicationEntity application = applicationRepository.save(ApplicationEntity.of(
            orderId, escortId, escort.getSquadId(), escort.getGameAccountId(), now));

        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.APPLICATION_SUBMITTED)
            .actorId(escort.getUserId())
            .orderId(orderId)
            .subjectId(escort.getUserId())
            .description("Escort " + escortId + " applied"
                + (escort.getSquadId() != null ? " with squad " + escort.getSquadId() : "")));

        metrics.recordApplication("accepted");
        log.info("Application accepted: orderId={}, escortId={}", orderId, escortId);
        return application;
    }

    /**
     * Binds the order to the given executors, OPEN → ASSIGNED. The first id gets
     * the first position, which matters for the payout split.
     *
     * @throws com.flagship.escort_market.error.AlreadyAssignedException if the order already has executors
     * @throws NoSuchApplicationException if an escort never applied
     */
    @Transactional
    public Order assign(UUID orderId, List<UUID> escortIds, UUID actorId) {
        validateExecutors(escortIds);
        Order order = orderPersistence.lockOrder(orderId);
        order.ensureAssignable();
        return bind(order, escortIds, actorId);
    }

    /**
     * Chooses the executors with the configured {@link AssignmentPolicy} among the
     * applicants that are not restricted right now.
     *
     * @throws NoSuchApplicationException if the policy finds no valid choice
     */
    @Transactional
    public Order autoAssign(UUID orderId, UUID actorId) {
        Instant now = Instant.now(clock);
        Order order = orderPersistence.lockOrder(orderId);
        order.ensureAssignable();

        List<ApplicationEntity> eligible = applicationRepository.findByOrderIdOrderByAppliedAtAscIdAsc(orderId)
            .stream()
            .filter(application -> !escortService.getEscort(application.getEscortId()).isRestrictedAt(now))
            .toList();

        List<UUID> chosen = assignmentPolicy.selectExecutors(eligible);
        if (chosen.isEmpty()) {
            throw new NoSuchApplicationException(orderId,
                "any eligible applicant under policy " + assignmentPolicy.name());
        }
        log.info("Policy {} chose executors {} for order {}", assignmentPolicy.name(), chosen, orderId);
        return bind(order, chosen, actorId);
    }

    /**
     * Releases the active assignments of an order that is being cancelled.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<UUID> releaseAssignments(UUID orderId) {
        Instant now = Instant.now(clock);
        List<AssignmentEntity> active = assignmentRepository.findByOrderIdAndReleasedAtIsNullOrderByPositionAsc(orderId);
        active.forEach(assignment -> assignment.release(now));
        return active.stream().map(AssignmentEntity::getEscortId).toList();
    }

    @Transactional(readOnly = true)
    public List<AssignmentEntity> getActiveAssignments(UUID orderId) {
        return assignmentRepository.findByOrderIdAndReleasedAtIsNullOrderByPositionAsc(orderId);
    }

    @Transactional(readOnly = true)
    public List<UUID> getActiveExecutorIds(UUID orderId) {
        return getActiveAssignments(orderId).stream().map(AssignmentEntity::getEscortId).toList();
    }

    @Transactional(readOnly = true)
    public List<AssignmentEntity> getAssignments(UUID orderId) {
        return assignmentRepository.findByOrderIdOrderByAssignedAtAscPositionAsc(orderId);
    }

    @Transactional(readOnly = true)
    public List<ApplicationEntity> getApplications(UUID orderId) {
        return applicationRepository.findByOrderIdOrderByAppliedAtAscIdAsc(orderId);
    }

    private Order bind(Order order, List<UUID> escortIds, UUID actorId) {
        Instant now = Instant.now(clock);
        List<ApplicationEntity> applications = new ArrayList<>();
        for (UUID escortId : escortIds) {
            ApplicationEntity application = applicationRepository.findByOrderIdAndEscortId(order.getId(), escortId)
                .orElseThrow(() -> new NoSuchApplicationException(order.getId(), escortId));
            escortService.getEscort(escortId).ensureEligible(now);
            applications.add(application);
        }

        for (int i = 0; i < escortIds.size(); i++) {
            assignmentRepository.save(AssignmentEntity.of(order.getId(), escortIds.get(i), i, now));
        }

        Order assigned = orderPersistence.update(order.assign(commonSquad(applications)));
        eventRecorder.recordTransition(order.getStatus(), assigned, ActionType.ORDER_ASSIGNED, actorId, escortIds,
            "Assigned to " + escortIds.size() + " executor(s)"
                + (assigned.getSquadId() != null ? " of squad " + assigned.getSquadId() : ""));
        return assigned;
    }

    /**
     * The squad shared by every executor at apply time, or null.
     */
    private static UUID commonSquad(List<ApplicationEntity> applications) {
        UUID squadId = applications.get(0).getSquadId();
        if (squadId == null) {
            return null;
        }
        boolean shared = applications.stream().allMatch(a -> Objects.equals(squadId, a.getSquadId()));
        return shared ? squadId : null;
    }

    private void validateExecutors(List<UUID> escortIds) {
        if (escortIds == null || escortIds.isEmpty()) {
            throw new IllegalArgumentException("At least one executor is required");
        }
        int max = properties.getAssignment().getMaxExecutors();
        if (escortIds.size() > max) {
            throw new IllegalArgumentException("At most " + max + " executors per order, got " + escortIds.size());
        }
        if (escortIds.stream().anyMatch(Objects::isNull) || new HashSet<>(escortIds).size() != escortIds.size()) {
            throw new IllegalArgumentException("Executor ids must be distinct and non-null: " + escortIds);
        }
    }
}
