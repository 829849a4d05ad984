package com.flagship.escort_market.api;

import com.flagship.escort_market.api.dto.CreateSquadRequest;
import com.flagship.escort_market.api.dto.EscortResponse;
import com.flagship.escort_market.api.dto.SquadResponse;
import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/squads")
@RequiredArgsConstructor
public class SquadController {

    private final MarketplaceCommandService commands;
    private final MarketplaceQueryService queries;

    @PostMapping
    public ResponseEntity<SquadResponse> createSquad(@Valid @RequestBody CreateSquadRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(SquadResponse.from(commands.createSquad(request.getName(), request.getActorId())));
    }

    @GetMapping("/{id}")
    public SquadResponse getSquad(@PathVariable("id") UUID id) {
        return SquadResponse.from(queries.getSquad(id));
    }

    @GetMapping(params = "name")
    public SquadResponse getSquadByName(@RequestParam("name") String name) {
        return SquadResponse.from(queries.getSquadByName(name));
    }

    @GetMapping("/{id}/members")
    public List<EscortResponse> getMembers(@PathVariable("id") UUID id) {
        return queries.getEscortsBySquad(id).stream().map(EscortResponse::from).toList();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> disbandSquad(@PathVariable("id") UUID id,
                                             @RequestParam(name = "actor_id", required = false) UUID actorId) {
        commands.disbandSquad(id, actorId);
        return ResponseEntity.noContent().build();
    }
}
