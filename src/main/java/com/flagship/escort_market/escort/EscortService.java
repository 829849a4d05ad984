package com.flagship.escort_market.escort;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.error.NotFoundException;
import com.flagship.escort_market.user.UserEntity;
import com.flagship.escort_market.user.UserService;
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
 * Worker profiles: registration, game account and rules acceptance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscortService {

    private final EscortRepository escortRepository;
    private final UserService userService;
    private final AuditLogService auditLog;
    private final Clock clock;

    /**
     * Turns the user into a worker. Returns the existing profile when the user already has one.
     */
    @Transactional
    public EscortEntity registerEscort(UUID userId) {
        UserEntity user = userService.lockUser(userId);
        return escortRepository.findByUserId(userId).orElseGet(() -> {
            user.markWorker();
            EscortEntity escort = escortRepository.save(EscortEntity.register(userId, Instant.now(clock)));
            auditLog.append(ActionLogEntry.builder()
                .actionType(ActionType.ESCORT_REGISTERED)
                .subjectId(userId)
                .description("Escort profile " + escort.getId() + " created"));
            log.info("Registered escort: escortId={}, userId={}", escort.getId(), userId);
            return escort;
        });
    }

    @Transactional
    public EscortEntity setGameAccount(UUID escortId, String gameAccountId) {
        if (gameAccountId == null || gameAccountId.isBlank()) {
            throw new IllegalArgumentException("Game account id is required");
        }
        EscortEntity escort = lockEscort(escortId);
        escort.setGameAccount(gameAccountId.trim());
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.ESCORT_PROFILE_UPDATED)
            .subjectId(escort.getUserId())
            .description("Game account set to " + escort.getGameAccountId()));
        return escort;
    }

    @Transactional
    public EscortEntity acceptRules(UUID escortId) {
        EscortEntity escort = lockEscort(escortId);
        if (!escort.isRulesAccepted()) {
            escort.acceptRules();
            auditLog.append(ActionLogEntry.builder()
                .actionType(ActionType.ESCORT_PROFILE_UPDATED)
                .subjectId(escort.getUserId())
                .description("Rules accepted"));
        }
        return escort;
    }

    @Transactional(readOnly = true)
    public EscortEntity getEscort(UUID escortId) {
        return escortRepository.findById(escortId)
            .orElseThrow(() -> new NotFoundException("Escort", escortId));
    }

    @Transactional(readOnly = true)
    public EscortEntity getByExternalId(long externalId) {
        return escortRepository.findByUserExternalId(externalId)
            .orElseThrow(() -> new NotFoundException("Escort with external id", externalId));
    }

    @Transactional(readOnly = true)
    public List<EscortEntity> getBySquad(UUID squadId) {
        return escortRepository.findBySquadIdOrderByRegisteredAtAsc(squadId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EscortEntity lockEscort(UUID escortId) {
        return escortRepository.findByIdForUpdate(escortId)
            .orElseThrow(() -> new NotFoundException("Escort", escortId));
    }
}
