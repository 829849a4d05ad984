package com.flagship.escort_market.api;

import com.flagship.escort_market.api.dto.ComplaintRequest;
import com.flagship.escort_market.api.dto.ComplaintResponse;
import com.flagship.escort_market.command.MarketplaceCommandService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/complaints")
@RequiredArgsConstructor
public class ComplaintController {

    private final MarketplaceCommandService commands;

    @PostMapping
    public ResponseEntity<ComplaintResponse> fileComplaint(@Valid @RequestBody ComplaintRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ComplaintResponse.from(
            commands.fileComplaint(request.getUserId(), request.getOrderId(), request.getText())));
    }
}
