package com.flagship.escort_market.order;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Memo id lookup for order creation: Redis fast path with database fallback.
 *
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the unique memo id column (always available)
 * 3. Warm Redis after a database hit
 *
 * The database stays the source of truth; Redis failures are logged and ignored.
 */
@Service
@Slf4j
public class OrderIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "memo:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final OrderRepository orderRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public OrderIdempotencyService(OrderRepository orderRepository,
                                   Optional<RedisTemplate<String, String>> redisTemplate) {
        this.orderRepository = orderRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the order created under this memo id, if any
     */
    public Optional<UUID> findOrderId(String memoId) {
        if (memoId == null || memoId.isBlank()) {
            throw new IllegalArgumentException("Memo id cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String orderId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + memoId);
                if (orderId != null) {
                    log.debug("Memo id found in Redis: {}", memoId);
                    return Optional.of(UUID.fromString(orderId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for memo id: {}. Falling back to database. Error: {}",
                        memoId, e.getMessage());
            }
        }

        Optional<UUID> orderId = orderRepository.findByMemoId(memoId).map(OrderEntity::getId);
        orderId.ifPresent(id -> {
            log.debug("Memo id found in database: {}", memoId);
            cache(memoId, id);
        });
        return orderId;
    }

    /**
     * Caches the memo id once the creating transaction has committed, so a rolled
     * back order never ends up in Redis.
     */
    public void remember(String memoId, UUID orderId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(memoId, orderId);
                }
            });
        } else {
            cache(memoId, orderId);
        }
    }

    /**
     * Drops a cached mapping that points to no order.
     */
    public void forget(String memoId) {
        redisTemplate.ifPresent(template -> {
            try {
                template.delete(REDIS_KEY_PREFIX + memoId);
            } catch (Exception e) {
                log.debug("Failed to evict memo id {} from Redis: {}", memoId, e.getMessage());
            }
        });
    }

    private void cache(String memoId, UUID orderId) {
        redisTemplate.ifPresent(template -> {
            try {
                template.opsForValue().set(REDIS_KEY_PREFIX + memoId, orderId.toString(), REDIS_TTL);
                log.debug("Stored memo id in Redis: {} -> {}", memoId, orderId);
            } catch (Exception e) {
                log.warn("Failed to store memo id in Redis: {}. Error: {}", memoId, e.getMessage());
            }
        });
    }
}
