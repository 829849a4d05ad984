package com.flagship.escort_market.reputation;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.escort.EscortService;
import com.flagship.escort_market.squad.SquadService;
import com.flagship.escort_market.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Worker ratings and ban/restriction windows.
 *
 * Ratings are running averages: {@code avg = (avg * count + score) / (count + 1)}.
 * Windows are only stored here; the assignment engine enforces them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReputationService {

    private final EscortService escortService;
    private final SquadService squadService;
    private final UserService userService;
    private final AuditLogService auditLog;

    /**
     * Applies a score to the escort, its user and its squad.
     */
    @Transactional
    public EscortEntity recordRating(UUID escortId, int score, UUID actorId) {
        validateScore(score);
        EscortEntity escort = applyToEscort(escortId, score);
        if (escort.getSquadId() != null) {
            squadService.lockSquad(escort.getSquadId()).recordRating(score);
        }
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.RATING_RECORDED)
            .actorId(actorId)
            .subjectId(escort.getUserId())
            .description("Rated " + score + ", average now " + escort.getRating()));
        return escort;
    }

    /**
     * Applies an order rating to every executor and once to the squad that executed
     * the order, the same squad whose counters the order feeds. {@code squadId} is null
     * for an order without a common squad.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void rateExecutors(List<UUID> escortIds, UUID squadId, int score) {
        validateScore(score);
        escortIds.forEach(escortId -> applyToEscort(escortId, score));
        if (squadId != null) {
            squadService.lockSquad(squadId).recordRating(score);
        }
        log.debug("Rating {} applied to executors {} and squad {}", score, escortIds, squadId);
    }

    /**
     * Bans until the given instant. A null or past instant clears the ban.
     */
    @Transactional
    public EscortEntity ban(UUID escortId, Instant until, UUID actorId) {
        EscortEntity escort = escortService.lockEscort(escortId);
        escort.ban(until);
        logWindow(escort, ActionType.WORKER_BANNED, actorId, "Banned until " + until);
        return escort;
    }

    @Transactional
    public EscortEntity banPermanently(UUID escortId, UUID actorId) {
        EscortEntity escort = escortService.lockEscort(escortId);
        escort.banPermanently();
        logWindow(escort, ActionType.WORKER_BANNED, actorId, "Banned permanently");
        return escort;
    }

    /**
     * Restricts until the given instant. A null or past instant clears the restriction.
     */
    @Transactional
    public EscortEntity restrict(UUID escortId, Instant until, UUID actorId) {
        EscortEntity escort = escortService.lockEscort(escortId);
        escort.restrict(until);
        logWindow(escort, ActionType.WORKER_RESTRICTED, actorId, "Restricted until " + until);
        return escort;
    }

    @Transactional
    public EscortEntity lift(UUID escortId, UUID actorId) {
        EscortEntity escort = escortService.lockEscort(escortId);
        escort.lift();
        logWindow(escort, ActionType.WORKER_UNRESTRICTED, actorId, "Bans and restrictions lifted");
        return escort;
    }

    private EscortEntity applyToEscort(UUID escortId, int score) {
        EscortEntity escort = escortService.lockEscort(escortId);
        escort.recordRating(score);
        userService.lockUser(escort.getUserId()).updateRating(escort.getRating());
        return escort;
    }

    private void logWindow(EscortEntity escort, ActionType type, UUID actorId, String description) {
        auditLog.append(ActionLogEntry.builder()
            .actionType(type)
            .actorId(actorId)
            .subjectId(escort.getUserId())
            .description(description));
        log.info("{}: escortId={}, {}", type, escort.getId(), description);
    }

    private static void validateScore(int score) {
        if (score < 1 || score > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got " + score);
        }
    }
}
