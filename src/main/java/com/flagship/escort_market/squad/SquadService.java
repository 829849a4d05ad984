package com.flagship.escort_market.squad;

import com.flagship.escort_market.assignment.ApplicationRepository;
import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.error.DuplicateSquadException;
import com.flagship.escort_market.error.InvalidTransitionException;
import com.flagship.escort_market.error.NotFoundException;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.escort.EscortRepository;
import com.flagship.escort_market.escort.EscortService;
import com.flagship.escort_market.order.OrderRepository;
import com.flagship.escort_market.order.OrderStatus;
import com.flagship.escort_market.settlement.PayoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Squad membership and the squad counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SquadService {

    private final SquadRepository squadRepository;
    private final EscortRepository escortRepository;
    private final EscortService escortService;
    private final OrderRepository orderRepository;
    private final ApplicationRepository applicationRepository;
    private final PayoutRepository payoutRepository;
    private final AuditLogService auditLog;
    private final Clock clock;

    /**
     * @throws DuplicateSquadException if the name is taken
     */
    @Transactional
    public SquadEntity createSquad(String name, UUID actorId) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Squad name is required");
        }
        String trimmed = name.trim();
        if (squadRepository.existsByName(trimmed)) {
            throw new DuplicateSquadException(trimmed);
        }
        SquadEntity squad = squadRepository.saveAndFlush(SquadEntity.create(trimmed, Instant.now(clock)));
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.SQUAD_CREATED)
            .actorId(actorId)
            .subjectId(squad.getId())
            .description("Squad '" + trimmed + "' created"));
        log.info("Created squad: squadId={}, name={}", squad.getId(), trimmed);
        return squad;
    }

    @Transactional
    public EscortEntity joinSquad(UUID escortId, UUID squadId) {
        // squad before escort, the order disbandSquad locks in
        SquadEntity squad = lockSquad(squadId);
        EscortEntity escort = escortService.lockEscort(escortId);
        if (squadId.equals(escort.getSquadId())) {
            return escort;
        }
        escort.joinSquad(squadId);
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.SQUAD_JOINED)
            .subjectId(escort.getUserId())
            .description("Joined squad '" + squad.getName() + "' (" + squadId + ")"));
        return escort;
    }

    @Transactional
    public EscortEntity leaveSquad(UUID escortId) {
        EscortEntity escort = escortService.lockEscort(escortId);
        UUID squadId = escort.getSquadId();
        if (squadId == null) {
            return escort;
        }
        escort.leaveSquad();
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.SQUAD_LEFT)
            .subjectId(escort.getUserId())
            .description("Left squad " + squadId));
        return escort;
    }

    /**
     * Detaches all members and deletes the squad.
     *
     * @throws InvalidTransitionException if an order was executed under the squad, or an
     *         open order holds an application made under it
     */
    @Transactional
    public void disbandSquad(UUID squadId, UUID actorId) {
        SquadEntity squad = squadRepository.findByIdForUpdate(squadId)
            .orElseThrow(() -> new NotFoundException("Squad", squadId));
        List<EscortEntity> members = escortRepository.findBySquadIdForUpdate(squadId);
        if (orderRepository.existsBySquadId(squadId)) {
            throw new InvalidTransitionException(
                "Squad " + squadId + " is referenced by orders and cannot be disbanded");
        }
        if (applicationRepository.existsBySquadIdAndOrderStatus(squadId, OrderStatus.OPEN)) {
            throw new InvalidTransitionException(
                "Squad " + squadId + " has applications on open orders and cannot be disbanded");
        }
        members.forEach(EscortEntity::leaveSquad);
        squadRepository.delete(squad);
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.SQUAD_DISBANDED)
            .actorId(actorId)
            .subjectId(squadId)
            .description("Squad '" + squad.getName() + "' disbanded, " + members.size() + " members detached"));
        log.info("Disbanded squad: squadId={}, members={}", squadId, members.size());
    }

    /**
     * Recomputes {@code totalOrders} and {@code totalEarnings} from settled orders and payouts.
     * Runs inside the transaction that settled the order, so the counters never drift.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public SquadEntity recomputeCounters(UUID squadId) {
        SquadEntity squad = squadRepository.findByIdForUpdate(squadId)
            .orElseThrow(() -> new NotFoundException("Squad", squadId));
        long totalOrders = orderRepository.countBySquadIdAndSettledAtIsNotNull(squadId);
        long totalEarnings = payoutRepository.sumAmountBySquadId(squadId);
        squad.applyCounters(totalOrders, totalEarnings);
        log.debug("Squad counters recomputed: squadId={}, totalOrders={}, totalEarnings={}",
                squadId, totalOrders, totalEarnings);
        return squad;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public SquadEntity lockSquad(UUID squadId) {
        return squadRepository.findByIdForUpdate(squadId)
            .orElseThrow(() -> new NotFoundException("Squad", squadId));
    }

    @Transactional(readOnly = true)
    public SquadEntity getSquad(UUID squadId) {
        return squadRepository.findById(squadId)
            .orElseThrow(() -> new NotFoundException("Squad", squadId));
    }

    @Transactional(readOnly = true)
    public SquadEntity getByName(String name) {
        return squadRepository.findByName(name)
            .orElseThrow(() -> new NotFoundException("Squad", name));
    }
}
