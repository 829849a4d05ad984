package com.flagship.escort_market.api;

import com.flagship.escort_market.api.dto.ActorRequest;
import com.flagship.escort_market.api.dto.EscortResponse;
import com.flagship.escort_market.api.dto.GameAccountRequest;
import com.flagship.escort_market.api.dto.JoinSquadRequest;
import com.flagship.escort_market.api.dto.RatingRequest;
import com.flagship.escort_market.api.dto.RegisterEscortRequest;
import com.flagship.escort_market.api.dto.RestrictionRequest;
import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Worker profiles, reputation and moderation.
 */
@RestController
@RequestMapping("/api/escorts")
@RequiredArgsConstructor
public class EscortController {

    private final MarketplaceCommandService commands;
    private final MarketplaceQueryService queries;

    @PostMapping
    public EscortResponse registerEscort(@Valid @RequestBody RegisterEscortRequest request) {
        return EscortResponse.from(commands.registerEscort(request.getUserId()));
    }

    @GetMapping("/{id}")
    public EscortResponse getEscort(@PathVariable("id") UUID id) {
        return EscortResponse.from(queries.getEscort(id));
    }

    @GetMapping(params = "external_id")
    public EscortResponse getEscortByExternalId(@RequestParam("external_id") long externalId) {
        return EscortResponse.from(queries.getEscortByExternalId(externalId));
    }

    @PutMapping("/{id}/game-account")
    public EscortResponse setGameAccount(@PathVariable("id") UUID id, @Valid @RequestBody GameAccountRequest request) {
        return EscortResponse.from(commands.setGameAccount(id, request.getGameAccountId()));
    }

    @PostMapping("/{id}/rules")
    public EscortResponse acceptRules(@PathVariable("id") UUID id) {
        return EscortResponse.from(commands.acceptRules(id));
    }

    @PostMapping("/{id}/ratings")
    public EscortResponse recordRating(@PathVariable("id") UUID id, @Valid @RequestBody RatingRequest request) {
        return EscortResponse.from(commands.recordRating(id, request.getScore(), request.getActorId()));
    }

    @PostMapping("/{id}/ban")
    public EscortResponse ban(@PathVariable("id") UUID id, @RequestBody RestrictionRequest request) {
        return EscortResponse.from(commands.banWorker(id, request.getUntil(), request.getActorId()));
    }

    @PostMapping("/{id}/ban-permanent")
    public EscortResponse banPermanently(@PathVariable("id") UUID id,
                                         @RequestBody(required = false) ActorRequest request) {
        return EscortResponse.from(commands.banWorkerPermanently(id, actorOf(request)));
    }

    @PostMapping("/{id}/restrict")
    public EscortResponse restrict(@PathVariable("id") UUID id, @RequestBody RestrictionRequest request) {
        return EscortResponse.from(commands.restrictWorker(id, request.getUntil(), request.getActorId()));
    }

    @PostMapping("/{id}/lift")
    public EscortResponse lift(@PathVariable("id") UUID id, @RequestBody(required = false) ActorRequest request) {
        return EscortResponse.from(commands.liftRestrictions(id, actorOf(request)));
    }

    @PostMapping("/{id}/squad")
    public EscortResponse joinSquad(@PathVariable("id") UUID id, @Valid @RequestBody JoinSquadRequest request) {
        return EscortResponse.from(commands.joinSquad(id, request.getSquadId()));
    }

    @DeleteMapping("/{id}/squad")
    public EscortResponse leaveSquad(@PathVariable("id") UUID id) {
        return EscortResponse.from(commands.leaveSquad(id));
    }

    private static UUID actorOf(ActorRequest request) {
        return request != null ? request.getActorId() : null;
    }
}
