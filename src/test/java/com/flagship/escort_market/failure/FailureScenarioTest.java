package com.flagship.escort_market.failure;

import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import com.flagship.escort_market.error.InsufficientBalanceException;
import com.flagship.escort_market.error.InvalidTransitionException;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.ledger.TransactionType;
import com.flagship.escort_market.order.CreateOrderResult;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderStatus;
import com.flagship.escort_market.outbox.OutboxService;
import com.flagship.escort_market.settlement.Payout;
import com.flagship.escort_market.support.Fixtures;
import com.flagship.escort_market.support.TestClockConfig;
import com.flagship.escort_market.user.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Failure scenarios: cache outages, rolled back commands and concurrent commands
 * on the same order or balance.
 */
@SpringBootTest
@Import(TestClockConfig.class)
class FailureScenarioTest {

    @Autowired
    private MarketplaceCommandService commands;

    @Autowired
    private MarketplaceQueryService queries;

    @Autowired
    private OutboxService outboxService;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private Fixtures fixtures;
    private UserEntity customer;

    @BeforeEach
    void setUp() {
        reset(valueOperations);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        fixtures = new Fixtures(commands);
        customer = fixtures.user("customer");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("FAILURE SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private void printInvariant(String invariant) {
        System.out.println("🔒 INVARIANT MAINTAINED: " + invariant);
    }

    private interface Task {
        void run() throws Exception;
    }

    /**
     * Runs every task at once and returns the exceptions they threw.
     */
    private List<Exception> runConcurrently(List<Task> tasks) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(tasks.size());
        List<Exception> failures = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        for (Task task : tasks) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    task.run();
                } catch (Exception e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "tasks did not finish");
        executor.shutdown();
        return failures;
    }

    @Nested
    @DisplayName("1. Redis failure scenarios")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Orders are created and deduplicated while Redis is down")
        void redisDown() {
            printTestHeader("Redis Completely Unavailable");
            when(valueOperations.get(anyString())).thenThrow(new RuntimeException("Redis connection refused"));
            doThrow(new RuntimeException("Redis connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
            String memo = Fixtures.uniqueMemo("redis-down");

            CreateOrderResult first = commands.createOrder(memo, customer.getId(), 1000, null);
            CreateOrderResult second = commands.createOrder(memo, customer.getId(), 1000, null);

            assertTrue(first.isCreated());
            assertFalse(second.isCreated());
            assertEquals(first.getOrder().getId(), second.getOrder().getId());
            printSuccess("Memo id deduplicated through the database");
            printInvariant("Database is the source of truth, Redis only a cache");
        }

        @Test
        @DisplayName("1.2 Memo id is cached only after the order commits")
        void cachedAfterCommit() {
            String memo = Fixtures.uniqueMemo("cached");

            Order order = commands.createOrder(memo, customer.getId(), 1000, null).getOrder();

            verify(valueOperations).set(eq("memo:" + memo), eq(order.getId().toString()), any(Duration.class));
        }

        @Test
        @DisplayName("1.3 A rejected order leaves nothing in Redis")
        void rollbackNotCached() {
            String memo = Fixtures.uniqueMemo("rejected");

            assertThrows(RuntimeException.class, () -> commands.createOrder(memo, UUID.randomUUID(), 1000, null));

            verify(valueOperations, never()).set(eq("memo:" + memo), anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("1.4 A stale cache entry pointing to no order is ignored")
        void staleCacheEntry() {
            String memo = Fixtures.uniqueMemo("stale");
            when(valueOperations.get("memo:" + memo)).thenReturn(UUID.randomUUID().toString());

            CreateOrderResult result = commands.createOrder(memo, customer.getId(), 1000, null);

            assertTrue(result.isCreated());
            assertEquals(memo, queries.getOrder(result.getOrder().getId()).getMemoId());
        }
    }

    @Nested
    @DisplayName("2. Rollback scenarios")
    class RollbackTests {

        @Test
        @DisplayName("2.1 A failed withdrawal leaves no hold, no withdrawal and no event")
        void failedWithdrawal() {
            printTestHeader("Rollback Leaves No Partial State");
            UserEntity worker = fixtures.fundedUser("worker", 50);
            long eventsBefore = outboxService.countUnpublished();

            assertThrows(InsufficientBalanceException.class, () -> commands.requestWithdrawal(worker.getId(), 80));

            assertEquals(50, queries.getBalance(worker.getId()));
            assertTrue(queries.getWithdrawals(worker.getId()).isEmpty());
            assertTrue(queries.getTransactions(worker.getId()).stream()
                .noneMatch(tx -> tx.getType() == TransactionType.WITHDRAWAL_HOLD));
            assertEquals(eventsBefore, outboxService.countUnpublished());
            printInvariant("Ledger, withdrawals and outbox change together or not at all");
        }

        @Test
        @DisplayName("2.2 A failed assignment binds nobody")
        void failedAssignment() {
            EscortEntity applicant = fixtures.escort("applicant");
            EscortEntity banned = fixtures.escort("banned");
            Order order = fixtures.openOrder(customer.getId(), 1000);
            commands.applyToOrder(order.getId(), applicant.getId());
            commands.applyToOrder(order.getId(), banned.getId());
            commands.banWorkerPermanently(banned.getId(), null);

            assertThrows(RuntimeException.class,
                () -> commands.assignOrder(order.getId(), List.of(applicant.getId(), banned.getId()), null));

            assertEquals(OrderStatus.OPEN, queries.getOrder(order.getId()).getStatus());
            assertTrue(queries.getAssignments(order.getId()).isEmpty());
        }
    }

    @Nested
    @DisplayName("3. Concurrent commands")
    class ConcurrencyTests {

        @Test
        @DisplayName("3.1 Concurrent completes credit the executors once")
        void concurrentComplete() throws Exception {
            printTestHeader("Concurrent Complete");
            EscortEntity escort = fixtures.escort("worker");
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));
            List<Task> tasks = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                tasks.add(() -> commands.completeOrder(order.getId(), null, null));
            }

            List<Exception> failures = runConcurrently(tasks);

            assertEquals(4, failures.size());
            assertTrue(failures.stream().allMatch(InvalidTransitionException.class::isInstance), failures.toString());
            assertEquals(900, queries.getBalance(escort.getUserId()));
            assertEquals(1, queries.getPayouts(order.getId()).size());
            printInvariant("Money moved exactly once");
        }

        @Test
        @DisplayName("3.2 Concurrent settle calls return the same payouts")
        void concurrentSettle() throws Exception {
            EscortEntity escort = fixtures.escort("worker");
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));
            commands.completeOrder(order.getId(), null, null);
            List<List<Payout>> results = Collections.synchronizedList(new ArrayList<>());
            List<Task> tasks = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                tasks.add(() -> results.add(commands.settleOrder(order.getId())));
            }

            List<Exception> failures = runConcurrently(tasks);

            assertTrue(failures.isEmpty(), failures.toString());
            List<Payout> payouts = queries.getPayouts(order.getId());
            assertEquals(5, results.size());
            assertTrue(results.stream().allMatch(payouts::equals));
            assertEquals(900, queries.getBalance(escort.getUserId()));
        }

        @Test
        @DisplayName("3.3 Concurrent withdrawals never overdraw")
        void concurrentWithdrawals() throws Exception {
            UserEntity worker = fixtures.fundedUser("worker", 100);
            AtomicInteger accepted = new AtomicInteger();
            List<Task> tasks = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                tasks.add(() -> {
                    commands.requestWithdrawal(worker.getId(), 30);
                    accepted.incrementAndGet();
                });
            }

            List<Exception> failures = runConcurrently(tasks);

            assertEquals(3, accepted.get());
            assertTrue(failures.stream().allMatch(InsufficientBalanceException.class::isInstance), failures.toString());
            assertEquals(10, queries.getBalance(worker.getId()));
            assertTrue(queries.verifyBalances().isEmpty());
        }

        @Test
        @DisplayName("3.4 Concurrent creates with one memo id produce one order")
        void concurrentCreate() throws Exception {
            String memo = Fixtures.uniqueMemo("race");
            Set<UUID> orderIds = ConcurrentHashMap.newKeySet();
            AtomicInteger created = new AtomicInteger();
            List<Task> tasks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                tasks.add(() -> {
                    CreateOrderResult result = commands.createOrder(memo, customer.getId(), 1000, null);
                    orderIds.add(result.getOrder().getId());
                    if (result.isCreated()) {
                        created.incrementAndGet();
                    }
                });
            }

            List<Exception> failures = runConcurrently(tasks);

            assertTrue(failures.isEmpty(), failures.toString());
            assertEquals(1, orderIds.size());
            assertEquals(1, created.get());
        }
    }
}
