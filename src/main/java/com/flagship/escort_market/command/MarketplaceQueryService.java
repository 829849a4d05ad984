package com.flagship.escort_market.command;

import com.flagship.escort_market.assignment.ApplicationEntity;
import com.flagship.escort_market.assignment.AssignmentEntity;
import com.flagship.escort_market.assignment.AssignmentService;
import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.AuditLogService;
import com.flagship.escort_market.complaint.ComplaintEntity;
import com.flagship.escort_market.complaint.ComplaintService;
import com.flagship.escort_market.error.NotFoundException;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.escort.EscortService;
import com.flagship.escort_market.ledger.BalanceMismatch;
import com.flagship.escort_market.ledger.LedgerService;
import com.flagship.escort_market.ledger.LedgerTransaction;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderPersistenceService;
import com.flagship.escort_market.order.OrderStatus;
import com.flagship.escort_market.report.OrderExportRow;
import com.flagship.escort_market.report.PeriodReport;
import com.flagship.escort_market.report.ReportService;
import com.flagship.escort_market.report.WorkerEarnings;
import com.flagship.escort_market.settlement.Payout;
import com.flagship.escort_market.settlement.SettlementService;
import com.flagship.escort_market.squad.SquadEntity;
import com.flagship.escort_market.squad.SquadService;
import com.flagship.escort_market.user.UserEntity;
import com.flagship.escort_market.user.UserService;
import com.flagship.escort_market.withdrawal.WithdrawalEntity;
import com.flagship.escort_market.withdrawal.WithdrawalService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the marketplace. Nothing here takes a lock.
 */
@Service
@RequiredArgsConstructor
public class MarketplaceQueryService {

    private final OrderPersistenceService orderPersistence;
    private final AssignmentService assignmentService;
    private final SettlementService settlementService;
    private final LedgerService ledgerService;
    private final WithdrawalService withdrawalService;
    private final UserService userService;
    private final EscortService escortService;
    private final SquadService squadService;
    private final AuditLogService auditLog;
    private final ComplaintService complaintService;
    private final ReportService reportService;

    public Order getOrder(UUID orderId) {
        return orderPersistence.getOrder(orderId);
    }

    public Order getOrderByMemoId(String memoId) {
        return orderPersistence.findByMemoId(memoId)
            .orElseThrow(() -> new NotFoundException("Order", memoId));
    }

    public List<Order> getOrdersByStatus(OrderStatus status) {
        return orderPersistence.findByStatus(status);
    }

    public List<ApplicationEntity> getApplications(UUID orderId) {
        orderPersistence.getOrder(orderId);
        return assignmentService.getApplications(orderId);
    }

    public List<AssignmentEntity> getAssignments(UUID orderId) {
        orderPersistence.getOrder(orderId);
        return assignmentService.getAssignments(orderId);
    }

    public List<Payout> getPayouts(UUID orderId) {
        orderPersistence.getOrder(orderId);
        return settlementService.getPayouts(orderId);
    }

    public UserEntity getUser(UUID userId) {
        return userService.getUser(userId);
    }

    public UserEntity getUserByExternalId(long externalId) {
        return userService.getByExternalId(externalId);
    }

    public EscortEntity getEscort(UUID escortId) {
        return escortService.getEscort(escortId);
    }

    public EscortEntity getEscortByExternalId(long externalId) {
        return escortService.getByExternalId(externalId);
    }

    public List<EscortEntity> getEscortsBySquad(UUID squadId) {
        squadService.getSquad(squadId);
        return escortService.getBySquad(squadId);
    }

    public SquadEntity getSquad(UUID squadId) {
        return squadService.getSquad(squadId);
    }

    public SquadEntity getSquadByName(String name) {
        return squadService.getByName(name);
    }

    public long getBalance(UUID userId) {
        return ledgerService.getBalance(userId);
    }

    public List<LedgerTransaction> getTransactions(UUID userId) {
        return ledgerService.getTransactions(userId);
    }

    public List<BalanceMismatch> verifyBalances() {
        return ledgerService.verifyBalances();
    }

    public WithdrawalEntity getWithdrawal(UUID withdrawalId) {
        return withdrawalService.getWithdrawal(withdrawalId);
    }

    public List<WithdrawalEntity> getWithdrawals(UUID userId) {
        return withdrawalService.getByUser(userId);
    }

    public List<WithdrawalEntity> getPendingWithdrawals() {
        return withdrawalService.getPending();
    }

    public List<ActionLogEntry> getActionLogForOrder(UUID orderId) {
        return auditLog.forOrder(orderId);
    }

    public List<ActionLogEntry> getActionLogForUser(UUID userId) {
        return auditLog.forUser(userId);
    }

    public List<ComplaintEntity> getComplaintsByUser(UUID userId) {
        return complaintService.getByUser(userId);
    }

    public List<ComplaintEntity> getComplaintsByOrder(UUID orderId) {
        return complaintService.getByOrder(orderId);
    }

    public PeriodReport periodReport(Instant from, Instant to) {
        return reportService.periodReport(from, to);
    }

    public WorkerEarnings workerEarnings(UUID userId) {
        return reportService.workerEarnings(userId);
    }

    public List<OrderExportRow> exportOrders() {
        return reportService.exportOrders();
    }

    public String exportOrdersCsv() {
        return reportService.exportOrdersCsv();
    }
}
