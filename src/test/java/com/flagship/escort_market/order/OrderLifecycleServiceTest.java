package com.flagship.escort_market.order;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import com.flagship.escort_market.error.DuplicateOrderException;
import com.flagship.escort_market.error.InvalidTransitionException;
import com.flagship.escort_market.error.NotFoundException;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.order.event.OrderEvent;
import com.flagship.escort_market.order.event.OrderSettledEvent;
import com.flagship.escort_market.order.event.OrderStatusChangedEvent;
import com.flagship.escort_market.outbox.OutboxEvent;
import com.flagship.escort_market.outbox.OutboxService;
import com.flagship.escort_market.settlement.Payout;
import com.flagship.escort_market.squad.SquadEntity;
import com.flagship.escort_market.support.Fixtures;
import com.flagship.escort_market.support.TestClockConfig;
import com.flagship.escort_market.user.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order lifecycle end to end, with the test commission of 10%.
 */
@SpringBootTest
@Import(TestClockConfig.class)
class OrderLifecycleServiceTest {

    @Autowired
    private MarketplaceCommandService commands;

    @Autowired
    private MarketplaceQueryService queries;

    @Autowired
    private OutboxService outboxService;

    private Fixtures fixtures;
    private UserEntity customer;

    @BeforeEach
    void setUp() {
        fixtures = new Fixtures(commands);
        customer = fixtures.user("customer");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private long balanceOf(EscortEntity escort) {
        return queries.getBalance(escort.getUserId());
    }

    @Nested
    @DisplayName("Creating orders")
    class Creating {

        @Test
        @DisplayName("Resubmitting the same memo id and content returns the existing order")
        void idempotentCreate() {
            String memo = Fixtures.uniqueMemo("memo");
            CreateOrderResult first = commands.createOrder(memo, customer.getId(), 1000, "boost to gold");
            CreateOrderResult second = commands.createOrder(memo, customer.getId(), 1000, "boost to gold");

            assertTrue(first.isCreated());
            assertFalse(second.isCreated());
            assertEquals(first.getOrder().getId(), second.getOrder().getId());
            assertEquals(first.getOrder().getId(), queries.getOrderByMemoId(memo).getId());
        }

        @Test
        @DisplayName("Same memo id with different content is a duplicate")
        void duplicateMemo() {
            String memo = Fixtures.uniqueMemo("memo");
            commands.createOrder(memo, customer.getId(), 1000, "boost to gold");

            assertThrows(DuplicateOrderException.class,
                () -> commands.createOrder(memo, customer.getId(), 2000, "boost to gold"));
            assertThrows(DuplicateOrderException.class,
                () -> commands.createOrder(memo, customer.getId(), 1000, "boost to platinum"));
        }

        @Test
        @DisplayName("Unknown customer is rejected and nothing is stored")
        void unknownCustomer() {
            String memo = Fixtures.uniqueMemo("ghost");
            assertThrows(NotFoundException.class,
                () -> commands.createOrder(memo, UUID.randomUUID(), 1000, null));
            assertThrows(NotFoundException.class, () -> queries.getOrderByMemoId(memo));
        }

        @Test
        @DisplayName("Non-positive amount is rejected")
        void nonPositiveAmount() {
            assertThrows(IllegalArgumentException.class,
                () -> commands.createOrder(Fixtures.uniqueMemo("zero"), customer.getId(), 0, null));
        }

        @Test
        @DisplayName("Creation is audited and published with no previous status")
        void creationRecorded() {
            Order order = fixtures.openOrder(customer.getId(), 700);

            List<ActionLogEntry> log = queries.getActionLogForOrder(order.getId());
            assertEquals(1, log.size());
            assertEquals(ActionType.ORDER_CREATED, log.get(0).getActionType());
            assertNull(log.get(0).getPreviousStatus());
            assertEquals("OPEN", log.get(0).getNewStatus());

            List<OutboxEvent> events = outboxService.getEventsForAggregate(OrderEvent.AGGREGATE_TYPE, order.getId());
            assertEquals(1, events.size());
            assertEquals(OrderStatusChangedEvent.EVENT_TYPE, events.get(0).getEventType());
            assertFalse(events.get(0).isPublished());
        }
    }

    @Test
    @DisplayName("Complete of a 1000 order pays the single executor 900")
    void completeSingleExecutor() {
        printTestHeader("Complete Single Executor");
        EscortEntity escort = fixtures.escort("solo");
        long before = balanceOf(escort);
        Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));

        Order completed = commands.completeOrder(order.getId(), null, null);
        List<Payout> payouts = queries.getPayouts(order.getId());

        printOutput("Order", completed);
        printOutput("Payouts", payouts);
        assertEquals(OrderStatus.COMPLETED, completed.getStatus());
        assertTrue(completed.isSettled());
        assertEquals(100, completed.getCommissionAmount());
        assertEquals(1, payouts.size());
        assertEquals(900, payouts.get(0).getAmount());
        assertEquals(100, payouts.get(0).getCommission());
        assertEquals(before + 900, balanceOf(escort));
        assertEquals(1, queries.getEscort(escort.getId()).getCompletedOrders());
        assertTrue(queries.verifyBalances().isEmpty());
        printSuccess("Executor credited 900");
    }

    @Test
    @DisplayName("Remainders go to the first executors and every unit is accounted for")
    void splitRemainder() {
        EscortEntity first = fixtures.escort("first");
        EscortEntity second = fixtures.escort("second");
        EscortEntity third = fixtures.escort("third");
        Order order = fixtures.assignedOrder(customer.getId(), 1001,
            List.of(first.getId(), second.getId(), third.getId()));

        commands.completeOrder(order.getId(), null, null);
        List<Payout> payouts = queries.getPayouts(order.getId());

        assertEquals(3, payouts.size());
        assertEquals(901, payouts.stream().mapToLong(Payout::getAmount).sum());
        assertEquals(100, payouts.stream().mapToLong(Payout::getCommission).sum());
        assertEquals(301, balanceOf(first));
        assertEquals(300, balanceOf(second));
        assertEquals(300, balanceOf(third));
    }

    @Test
    @DisplayName("Settling a settled order returns the same payouts and credits nothing")
    void settleTwice() {
        EscortEntity escort = fixtures.escort("settle");
        Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));
        commands.completeOrder(order.getId(), null, null);
        long after = balanceOf(escort);

        List<Payout> again = commands.settleOrder(order.getId());

        assertEquals(queries.getPayouts(order.getId()), again);
        assertEquals(after, balanceOf(escort));
        assertEquals(1, queries.getTransactions(escort.getUserId()).size());
    }

    @Test
    @DisplayName("Settling an order that is not completed fails")
    void settleNotCompleted() {
        EscortEntity escort = fixtures.escort("early");
        Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));

        assertThrows(InvalidTransitionException.class, () -> commands.settleOrder(order.getId()));
        assertTrue(queries.getPayouts(order.getId()).isEmpty());
    }

    @Test
    @DisplayName("Squad counters follow settled orders of the squad")
    void squadCounters() {
        SquadEntity squad = fixtures.squad("falcons");
        EscortEntity a = fixtures.escort("a");
        EscortEntity b = fixtures.escort("b");
        commands.joinSquad(a.getId(), squad.getId());
        commands.joinSquad(b.getId(), squad.getId());

        Order first = fixtures.assignedOrder(customer.getId(), 1000, List.of(a.getId(), b.getId()));
        commands.completeOrder(first.getId(), null, null);
        Order second = fixtures.assignedOrder(customer.getId(), 500, List.of(a.getId()));
        commands.completeOrder(second.getId(), null, null);

        SquadEntity stored = queries.getSquad(squad.getId());
        assertEquals(2, stored.getTotalOrders());
        assertEquals(900 + 450, stored.getTotalEarnings());
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("Start then complete, each step audited and published")
        void fullPath() {
            EscortEntity escort = fixtures.escort("worker");
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));

            Order started = commands.startOrder(order.getId(), escort.getUserId());
            assertEquals(OrderStatus.IN_PROGRESS, started.getStatus());
            assertNotNull(started.getStartedAt());

            commands.completeOrder(order.getId(), null, customer.getId());

            List<ActionType> actions = queries.getActionLogForOrder(order.getId()).stream()
                .map(ActionLogEntry::getActionType)
                .toList();
            assertEquals(List.of(ActionType.ORDER_COMPLETED, ActionType.ORDER_STARTED, ActionType.ORDER_ASSIGNED,
                ActionType.APPLICATION_SUBMITTED, ActionType.ORDER_CREATED), actions);

            List<OutboxEvent> events = outboxService.getEventsForAggregate(OrderEvent.AGGREGATE_TYPE, order.getId());
            assertEquals(4, events.stream().filter(e -> e.getEventType().equals(OrderStatusChangedEvent.EVENT_TYPE)).count());
            assertEquals(1, events.stream().filter(e -> e.getEventType().equals(OrderSettledEvent.EVENT_TYPE)).count());
        }

        @Test
        @DisplayName("Cancel of an assigned order releases the executors and moves no money")
        void cancelAssigned() {
            EscortEntity escort = fixtures.escort("released");
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));

            Order cancelled = commands.cancelOrder(order.getId(), customer.getId());

            assertEquals(OrderStatus.CANCELLED, cancelled.getStatus());
            assertTrue(queries.getAssignments(order.getId()).stream().noneMatch(a -> a.isActive()));
            assertEquals(0, balanceOf(escort));
        }

        @Test
        @DisplayName("Cancel of an open order succeeds")
        void cancelOpen() {
            Order order = fixtures.openOrder(customer.getId(), 1000);
            assertEquals(OrderStatus.CANCELLED, commands.cancelOrder(order.getId(), null).getStatus());
        }

        @Test
        @DisplayName("Invalid transitions are rejected and leave the order as it was")
        void invalidTransitions() {
            EscortEntity escort = fixtures.escort("busy");
            Order open = fixtures.openOrder(customer.getId(), 1000);
            assertThrows(InvalidTransitionException.class, () -> commands.completeOrder(open.getId(), null, null));
            assertThrows(InvalidTransitionException.class, () -> commands.startOrder(open.getId(), null));

            Order running = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));
            commands.startOrder(running.getId(), null);
            assertThrows(InvalidTransitionException.class, () -> commands.cancelOrder(running.getId(), null));
            assertEquals(OrderStatus.IN_PROGRESS, queries.getOrder(running.getId()).getStatus());

            commands.completeOrder(running.getId(), null, null);
            assertThrows(InvalidTransitionException.class, () -> commands.cancelOrder(running.getId(), null));
            assertEquals(OrderStatus.OPEN, queries.getOrder(open.getId()).getStatus());
        }

        @Test
        @DisplayName("Unknown order is not found")
        void unknownOrder() {
            assertThrows(NotFoundException.class, () -> commands.startOrder(UUID.randomUUID(), null));
        }
    }

    @Nested
    @DisplayName("Ratings")
    class Ratings {

        @Test
        @DisplayName("Rating at completion reaches the executors, their users and their squad once")
        void completeWithRating() {
            SquadEntity squad = fixtures.squad("owls");
            EscortEntity a = fixtures.escort("a");
            EscortEntity b = fixtures.escort("b");
            commands.joinSquad(a.getId(), squad.getId());
            commands.joinSquad(b.getId(), squad.getId());
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(a.getId(), b.getId()));

            Order completed = commands.completeOrder(order.getId(), 4, null);

            assertEquals(4, completed.getRating());
            assertEquals(4.0, queries.getEscort(a.getId()).getRating(), 1e-9);
            assertEquals(1, queries.getEscort(b.getId()).getRatingCount());
            assertEquals(4.0, queries.getUser(a.getUserId()).getRating(), 1e-9);
            assertEquals(1, queries.getSquad(squad.getId()).getRatingCount());
        }

        @Test
        @DisplayName("The rating goes to the squad that executed the order, even after an executor moved on")
        void ratingFollowsExecutingSquad() {
            SquadEntity executing = fixtures.squad("executing");
            SquadEntity other = fixtures.squad("other");
            EscortEntity a = fixtures.escort("a");
            EscortEntity b = fixtures.escort("b");
            commands.joinSquad(a.getId(), executing.getId());
            commands.joinSquad(b.getId(), executing.getId());
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(a.getId(), b.getId()));
            commands.joinSquad(a.getId(), other.getId());

            commands.completeOrder(order.getId(), 5, null);

            SquadEntity rated = queries.getSquad(executing.getId());
            assertEquals(1, rated.getRatingCount());
            assertEquals(5.0, rated.getRating(), 1e-9);
            assertEquals(1, rated.getTotalOrders());
            assertEquals(0, queries.getSquad(other.getId()).getRatingCount());
            assertEquals(0, queries.getSquad(other.getId()).getTotalOrders());
        }

        @Test
        @DisplayName("An order is rated once")
        void rateOnce() {
            EscortEntity escort = fixtures.escort("rated");
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));
            commands.completeOrder(order.getId(), null, null);

            Order rated = commands.rateOrder(order.getId(), 5, customer.getId());

            assertEquals(5, rated.getRating());
            assertEquals(5.0, queries.getEscort(escort.getId()).getRating(), 1e-9);
            assertThrows(InvalidTransitionException.class, () -> commands.rateOrder(order.getId(), 1, null));
            assertEquals(1, queries.getEscort(escort.getId()).getRatingCount());
        }

        @Test
        @DisplayName("Out of range scores and unfinished orders are rejected")
        void invalidRatings() {
            EscortEntity escort = fixtures.escort("unrated");
            Order order = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));

            assertThrows(InvalidTransitionException.class, () -> commands.rateOrder(order.getId(), 3, null));
            assertThrows(IllegalArgumentException.class, () -> commands.completeOrder(order.getId(), 6, null));
            assertEquals(OrderStatus.ASSIGNED, queries.getOrder(order.getId()).getStatus());
        }
    }
}
