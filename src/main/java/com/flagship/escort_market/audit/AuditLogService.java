package com.flagship.escort_market.audit;

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
 * Append-only action log used for dispute resolution.
 *
 * Entries are written inside the business transaction that made the change,
 * so a rolled back command leaves no entry behind. Failed attempts are not logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private final ActionLogRepository repository;
    private final Clock clock;

    /**
     * Appends an entry. Must run inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ActionLogEntry append(ActionLogEntry.ActionLogEntryBuilder entry) {
        ActionLogEntry complete = entry
            .id(UUID.randomUUID())
            .createdAt(Instant.now(clock))
            .build();
        repository.save(ActionLogEntity.fromDomain(complete));
        log.debug("Action logged: type={}, orderId={}, subjectId={}",
                complete.getActionType(), complete.getOrderId(), complete.getSubjectId());
        return complete;
    }

    @Transactional(readOnly = true)
    public List<ActionLogEntry> forOrder(UUID orderId) {
        return repository.findByOrderIdOrderByCreatedAtDesc(orderId).stream()
            .map(ActionLogEntity::toDomain)
            .toList();
    }

    /**
     * Entries where the user acted or was the subject of the action.
     */
    @Transactional(readOnly = true)
    public List<ActionLogEntry> forUser(UUID userId) {
        return repository.findByUser(userId).stream()
            .map(ActionLogEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasEntrySince(UUID orderId, ActionType actionType, Instant since) {
        return repository.existsByOrderIdAndActionTypeAndCreatedAtAfter(orderId, actionType, since);
    }
}
