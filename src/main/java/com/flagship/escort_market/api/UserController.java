package com.flagship.escort_market.api;

import com.flagship.escort_market.api.dto.ActionLogResponse;
import com.flagship.escort_market.api.dto.ActorRequest;
import com.flagship.escort_market.api.dto.AdjustBalanceRequest;
import com.flagship.escort_market.api.dto.BalanceResponse;
import com.flagship.escort_market.api.dto.ComplaintResponse;
import com.flagship.escort_market.api.dto.RegisterUserRequest;
import com.flagship.escort_market.api.dto.TransactionResponse;
import com.flagship.escort_market.api.dto.UserResponse;
import com.flagship.escort_market.api.dto.WithdrawalRequest;
import com.flagship.escort_market.api.dto.WithdrawalResponse;
import com.flagship.escort_market.api.dto.WorkerEarningsResponse;
import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import com.flagship.escort_market.ledger.LedgerTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Users, their balances and withdrawal requests.
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final MarketplaceCommandService commands;
    private final MarketplaceQueryService queries;

    @PostMapping
    public UserResponse registerUser(@Valid @RequestBody RegisterUserRequest request) {
        return UserResponse.from(commands.registerUser(request.getExternalId(), request.getDisplayName()));
    }

    @GetMapping("/{id}")
    public UserResponse getUser(@PathVariable("id") UUID id) {
        return UserResponse.from(queries.getUser(id));
    }

    @GetMapping(params = "external_id")
    public UserResponse getUserByExternalId(@RequestParam("external_id") long externalId) {
        return UserResponse.from(queries.getUserByExternalId(externalId));
    }

    @GetMapping("/{id}/balance")
    public BalanceResponse getBalance(@PathVariable("id") UUID id) {
        return new BalanceResponse(id, queries.getBalance(id));
    }

    @GetMapping("/{id}/transactions")
    public List<TransactionResponse> getTransactions(@PathVariable("id") UUID id) {
        return queries.getTransactions(id).stream().map(TransactionResponse::from).toList();
    }

    @PostMapping("/{id}/balance/adjust")
    public TransactionResponse adjustBalance(@PathVariable("id") UUID id,
                                             @Valid @RequestBody AdjustBalanceRequest request) {
        return TransactionResponse.from(
            commands.adjustBalance(id, request.getAmount(), request.getOperatorId(), request.getReason()));
    }

    /**
     * Answers 204 when the balance already was zero.
     */
    @PostMapping("/{id}/balance/zero")
    public ResponseEntity<TransactionResponse> zeroBalance(@PathVariable("id") UUID id,
                                                           @RequestBody(required = false) ActorRequest request) {
        LedgerTransaction tx = commands.zeroBalance(id, request != null ? request.getActorId() : null);
        if (tx == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(TransactionResponse.from(tx));
    }

    @PostMapping("/{id}/withdrawals")
    public ResponseEntity<WithdrawalResponse> requestWithdrawal(@PathVariable("id") UUID id,
                                                                @Valid @RequestBody WithdrawalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(WithdrawalResponse.from(commands.requestWithdrawal(id, request.getAmount())));
    }

    @GetMapping("/{id}/withdrawals")
    public List<WithdrawalResponse> getWithdrawals(@PathVariable("id") UUID id) {
        return queries.getWithdrawals(id).stream().map(WithdrawalResponse::from).toList();
    }

    @GetMapping("/{id}/earnings")
    public WorkerEarningsResponse getEarnings(@PathVariable("id") UUID id) {
        return WorkerEarningsResponse.from(queries.workerEarnings(id));
    }

    @GetMapping("/{id}/actions")
    public List<ActionLogResponse> getActionLog(@PathVariable("id") UUID id) {
        return queries.getActionLogForUser(id).stream().map(ActionLogResponse::from).toList();
    }

    @GetMapping("/{id}/complaints")
    public List<ComplaintResponse> getComplaints(@PathVariable("id") UUID id) {
        return queries.getComplaintsByUser(id).stream().map(ComplaintResponse::from).toList();
    }
}
