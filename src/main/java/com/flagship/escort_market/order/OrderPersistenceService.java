package com.flagship.escort_market.order;

import com.flagship.escort_market.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Order} domain object and {@link OrderEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPersistenceService {

    private final OrderRepository orderRepository;

    /**
     * Inserts a new order. Flushes immediately so a memo id clash surfaces here
     * and not at commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Order insert(Order order) {
        OrderEntity saved = orderRepository.saveAndFlush(OrderEntity.fromDomain(order));
        log.debug("Saved order {} with memo id {}", saved.getId(), saved.getMemoId());
        return saved.toDomain();
    }

    /**
     * Loads the order under a row lock held until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Order lockOrder(UUID orderId) {
        return orderRepository.findByIdForUpdate(orderId)
            .map(OrderEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Order", orderId));
    }

    /**
     * Writes the new state of an order previously loaded with {@link #lockOrder(UUID)}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Order update(Order order) {
        OrderEntity existing = orderRepository.findById(order.getId())
            .orElseThrow(() -> new NotFoundException("Order", order.getId()));
        existing.updateFromDomain(order);
        log.debug("Updated order {} to {}", order.getId(), order.getStatus());
        return existing.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Order> findById(UUID orderId) {
        return orderRepository.findById(orderId).map(OrderEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Order getOrder(UUID orderId) {
        return findById(orderId).orElseThrow(() -> new NotFoundException("Order", orderId));
    }

    @Transactional(readOnly = true)
    public Optional<Order> findByMemoId(String memoId) {
        return orderRepository.findByMemoId(memoId).map(OrderEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Order> findByStatus(OrderStatus status) {
        return orderRepository.findByStatusOrderByCreatedAtAsc(status).stream()
            .map(OrderEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Order> findStale(Collection<OrderStatus> statuses, Instant createdBefore) {
        return orderRepository.findStale(statuses, createdBefore).stream()
            .map(OrderEntity::toDomain)
            .toList();
    }
}
