package com.flagship.escort_market.user;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Registration and lookup of marketplace users.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final AuditLogService auditLog;
    private final Clock clock;

    /**
     * Returns the user for the external id, creating it on first contact.
     * A concurrent first contact loses on the unique external id and is retried by the facade.
     */
    @Transactional
    public UserEntity registerUser(long externalId, String displayName) {
        return userRepository.findByExternalId(externalId).orElseGet(() -> {
            UserEntity user = userRepository.save(
                UserEntity.register(externalId, displayName, Instant.now(clock)));
            auditLog.append(ActionLogEntry.builder()
                .actionType(ActionType.USER_REGISTERED)
                .subjectId(user.getId())
                .description("Registered external user " + externalId));
            log.info("Registered user: userId={}, externalId={}", user.getId(), externalId);
            return user;
        });
    }

    @Transactional(readOnly = true)
    public UserEntity getUser(UUID userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new NotFoundException("User", userId));
    }

    @Transactional(readOnly = true)
    public UserEntity getByExternalId(long externalId) {
        return userRepository.findByExternalId(externalId)
            .orElseThrow(() -> new NotFoundException("User with external id", externalId));
    }

    /**
     * Row-locked load for callers that mutate the user inside their own transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UserEntity lockUser(UUID userId) {
        return userRepository.findByIdForUpdate(userId)
            .orElseThrow(() -> new NotFoundException("User", userId));
    }
}
