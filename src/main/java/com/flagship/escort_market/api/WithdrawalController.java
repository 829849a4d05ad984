package com.flagship.escort_market.api;

import com.flagship.escort_market.api.dto.ResolveWithdrawalRequest;
import com.flagship.escort_market.api.dto.WithdrawalResponse;
import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/withdrawals")
@RequiredArgsConstructor
public class WithdrawalController {

    private final MarketplaceCommandService commands;
    private final MarketplaceQueryService queries;

    @GetMapping("/{id}")
    public WithdrawalResponse getWithdrawal(@PathVariable("id") UUID id) {
        return WithdrawalResponse.from(queries.getWithdrawal(id));
    }

    @GetMapping("/pending")
    public List<WithdrawalResponse> getPending() {
        return queries.getPendingWithdrawals().stream().map(WithdrawalResponse::from).toList();
    }

    @PostMapping("/{id}/resolve")
    public WithdrawalResponse resolve(@PathVariable("id") UUID id,
                                      @Valid @RequestBody ResolveWithdrawalRequest request) {
        return WithdrawalResponse.from(commands.resolveWithdrawal(id, request.getApprove(), request.getOperatorId()));
    }
}
