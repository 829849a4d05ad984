package com.flagship.escort_market.complaint;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.order.OrderPersistenceService;
import com.flagship.escort_market.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ComplaintService {

    static final int MAX_TEXT_LENGTH = 4000;

    private final ComplaintRepository complaintRepository;
    private final UserService userService;
    private final OrderPersistenceService orderPersistence;
    private final AuditLogService auditLog;
    private final Clock clock;

    @Transactional
    public ComplaintEntity fileComplaint(UUID userId, UUID orderId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Complaint text is required");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("Complaint text is longer than " + MAX_TEXT_LENGTH + " characters");
        }
        userService.getUser(userId);
        if (orderId != null) {
            orderPersistence.getOrder(orderId);
        }

        ComplaintEntity complaint = complaintRepository.save(
            ComplaintEntity.of(userId, orderId, text.trim(), Instant.now(clock)));
        auditLog.append(ActionLogEntry.builder()
            .actionType(ActionType.COMPLAINT_FILED)
            .actorId(userId)
            .orderId(orderId)
            .subjectId(userId)
            .description("Complaint " + complaint.getId() + " filed"));

        log.info("Complaint filed: complaintId={}, orderId={}", complaint.getId(), orderId);
        return complaint;
    }

    @Transactional(readOnly = true)
    public List<ComplaintEntity> getByUser(UUID userId) {
        return complaintRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<ComplaintEntity> getByOrder(UUID orderId) {
        return complaintRepository.findByOrderIdOrderByCreatedAtDesc(orderId);
    }
}
