package com.flagship.escort_market.api;

import com.flagship.escort_market.api.dto.ActionLogResponse;
import com.flagship.escort_market.api.dto.ActorRequest;
import com.flagship.escort_market.api.dto.ApplicationResponse;
import com.flagship.escort_market.api.dto.ApplyRequest;
import com.flagship.escort_market.api.dto.AssignOrderRequest;
import com.flagship.escort_market.api.dto.AssignmentResponse;
import com.flagship.escort_market.api.dto.ComplaintResponse;
import com.flagship.escort_market.api.dto.CompleteOrderRequest;
import com.flagship.escort_market.api.dto.CreateOrderRequest;
import com.flagship.escort_market.api.dto.OrderResponse;
import com.flagship.escort_market.api.dto.PayoutResponse;
import com.flagship.escort_market.api.dto.RatingRequest;
import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import com.flagship.escort_market.order.CreateOrderResult;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
 * REST controller for the order lifecycle.
 *
 * Order creation is idempotent on {@code memo_id}: the first call answers 201,
 * a retry with the same content answers 200 with the same order.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private final MarketplaceCommandService commands;
    private final MarketplaceQueryService queries;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        log.info("Received order creation request: memoId={}, amount={}", request.getMemoId(), request.getAmount());

        CreateOrderResult result = commands.createOrder(
            request.getMemoId(), request.getCustomerId(), request.getAmount(), request.getDescription());

        return ResponseEntity.status(result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK)
            .body(OrderResponse.from(result.getOrder()));
    }

    @GetMapping("/{id}")
    public OrderResponse getOrder(@PathVariable("id") UUID id) {
        return OrderResponse.from(queries.getOrder(id));
    }

    @GetMapping(params = "memo_id")
    public OrderResponse getOrderByMemoId(@RequestParam("memo_id") String memoId) {
        return OrderResponse.from(queries.getOrderByMemoId(memoId));
    }

    @GetMapping(params = "status")
    public List<OrderResponse> getOrdersByStatus(@RequestParam("status") OrderStatus status) {
        return queries.getOrdersByStatus(status).stream().map(OrderResponse::from).toList();
    }

    @PostMapping("/{id}/applications")
    public ResponseEntity<ApplicationResponse> apply(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody ApplyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApplicationResponse.from(commands.applyToOrder(id, request.getEscortId())));
    }

    @GetMapping("/{id}/applications")
    public List<ApplicationResponse> getApplications(@PathVariable("id") UUID id) {
        return queries.getApplications(id).stream().map(ApplicationResponse::from).toList();
    }

    @PostMapping("/{id}/assign")
    public OrderResponse assign(@PathVariable("id") UUID id, @Valid @RequestBody AssignOrderRequest request) {
        return OrderResponse.from(commands.assignOrder(id, request.getEscortIds(), request.getActorId()));
    }

    @PostMapping("/{id}/auto-assign")
    public OrderResponse autoAssign(@PathVariable("id") UUID id,
                                    @RequestBody(required = false) ActorRequest request) {
        return OrderResponse.from(commands.autoAssignOrder(id, actorOf(request)));
    }

    @GetMapping("/{id}/assignments")
    public List<AssignmentResponse> getAssignments(@PathVariable("id") UUID id) {
        return queries.getAssignments(id).stream().map(AssignmentResponse::from).toList();
    }

    @PostMapping("/{id}/start")
    public OrderResponse start(@PathVariable("id") UUID id, @RequestBody(required = false) ActorRequest request) {
        return OrderResponse.from(commands.startOrder(id, actorOf(request)));
    }

    @PostMapping("/{id}/complete")
    public OrderResponse complete(@PathVariable("id") UUID id,
                                  @Valid @RequestBody(required = false) CompleteOrderRequest request) {
        Integer rating = request != null ? request.getRating() : null;
        UUID actorId = request != null ? request.getActorId() : null;
        return OrderResponse.from(commands.completeOrder(id, rating, actorId));
    }

    @PostMapping("/{id}/cancel")
    public OrderResponse cancel(@PathVariable("id") UUID id, @RequestBody(required = false) ActorRequest request) {
        return OrderResponse.from(commands.cancelOrder(id, actorOf(request)));
    }

    @PostMapping("/{id}/rate")
    public OrderResponse rate(@PathVariable("id") UUID id, @Valid @RequestBody RatingRequest request) {
        Order rated = commands.rateOrder(id, request.getScore(), request.getActorId());
        return OrderResponse.from(rated);
    }

    /**
     * Settles a completed order. Safe to call again: returns the existing payouts.
     */
    @PostMapping("/{id}/settle")
    public List<PayoutResponse> settle(@PathVariable("id") UUID id) {
        return commands.settleOrder(id).stream().map(PayoutResponse::from).toList();
    }

    @GetMapping("/{id}/payouts")
    public List<PayoutResponse> getPayouts(@PathVariable("id") UUID id) {
        return queries.getPayouts(id).stream().map(PayoutResponse::from).toList();
    }

    @GetMapping("/{id}/actions")
    public List<ActionLogResponse> getActionLog(@PathVariable("id") UUID id) {
        return queries.getActionLogForOrder(id).stream().map(ActionLogResponse::from).toList();
    }

    @GetMapping("/{id}/complaints")
    public List<ComplaintResponse> getComplaints(@PathVariable("id") UUID id) {
        return queries.getComplaintsByOrder(id).stream().map(ComplaintResponse::from).toList();
    }

    private static UUID actorOf(ActorRequest request) {
        return request != null ? request.getActorId() : null;
    }
}
