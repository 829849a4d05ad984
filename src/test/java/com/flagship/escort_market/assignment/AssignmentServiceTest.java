package com.flagship.escort_market.assignment;

import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import com.flagship.escort_market.error.AlreadyAssignedException;
import com.flagship.escort_market.error.ApplicationLimitReachedException;
import com.flagship.escort_market.error.DuplicateApplicationException;
import com.flagship.escort_market.error.GameAccountRequiredException;
import com.flagship.escort_market.error.NoSuchApplicationException;
import com.flagship.escort_market.error.OrderNotOpenException;
import com.flagship.escort_market.error.WorkerRestrictedException;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.order.OrderStatus;
import com.flagship.escort_market.squad.SquadEntity;
import com.flagship.escort_market.support.Fixtures;
import com.flagship.escort_market.support.MutableClock;
import com.flagship.escort_market.support.TestClockConfig;
import com.flagship.escort_market.user.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Applications and assignments: who may apply, who becomes executor, and that
 * an order never gets two executor sets.
 */
@SpringBootTest
@Import(TestClockConfig.class)
class AssignmentServiceTest {

    @Autowired
    private MarketplaceCommandService commands;

    @Autowired
    private MarketplaceQueryService queries;

    @Autowired
    private AssignmentService assignmentService;

    @Autowired
    private MutableClock clock;

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

    @Nested
    @DisplayName("Applying")
    class Applying {

        @Test
        @DisplayName("Application snapshots the escort's squad and game account")
        void applicationSnapshot() {
            EscortEntity escort = fixtures.escort("gamer");
            SquadEntity squad = fixtures.squad("wolves");
            commands.setGameAccount(escort.getId(), "GAME-42");
            commands.joinSquad(escort.getId(), squad.getId());
            Order order = fixtures.openOrder(customer.getId(), 500);

            ApplicationEntity application = commands.applyToOrder(order.getId(), escort.getId());

            assertEquals(squad.getId(), application.getSquadId());
            assertEquals("GAME-42", application.getGameAccountId());

            commands.leaveSquad(escort.getId());
            ApplicationEntity stored = queries.getApplications(order.getId()).get(0);
            assertEquals(squad.getId(), stored.getSquadId(), "snapshot survives leaving the squad");
        }

        @Test
        @DisplayName("Second application of the same escort is a duplicate")
        void duplicateApplication() {
            EscortEntity escort = fixtures.escort("twice");
            Order order = fixtures.openOrder(customer.getId(), 500);
            commands.applyToOrder(order.getId(), escort.getId());

            assertThrows(DuplicateApplicationException.class,
                () -> commands.applyToOrder(order.getId(), escort.getId()));
            assertEquals(1, queries.getApplications(order.getId()).size());
        }

        @Test
        @DisplayName("Applications stop at the configured limit")
        void applicationLimit() {
            Order order = fixtures.openOrder(customer.getId(), 500);
            for (int i = 0; i < 4; i++) {
                commands.applyToOrder(order.getId(), fixtures.escort("e" + i).getId());
            }
            EscortEntity late = fixtures.escort("late");

            assertThrows(ApplicationLimitReachedException.class,
                () -> commands.applyToOrder(order.getId(), late.getId()));
        }

        @Test
        @DisplayName("Applying to an order that is not OPEN fails")
        void orderNotOpen() {
            EscortEntity escort = fixtures.escort("slow");
            Order order = fixtures.openOrder(customer.getId(), 500);
            commands.cancelOrder(order.getId(), null);

            assertThrows(OrderNotOpenException.class, () -> commands.applyToOrder(order.getId(), escort.getId()));
        }

        @Test
        @DisplayName("Escort without a game account cannot apply until one is set")
        void gameAccountRequired() {
            EscortEntity escort = commands.registerEscort(fixtures.user("no-account").getId());
            Order order = fixtures.openOrder(customer.getId(), 500);

            assertThrows(GameAccountRequiredException.class,
                () -> commands.applyToOrder(order.getId(), escort.getId()));
            assertTrue(queries.getApplications(order.getId()).isEmpty());

            commands.setGameAccount(escort.getId(), "GAME-7");
            ApplicationEntity application = commands.applyToOrder(order.getId(), escort.getId());
            assertEquals("GAME-7", application.getGameAccountId());
        }

        @Test
        @DisplayName("Restricted escort cannot apply")
        void restrictedCannotApply() {
            EscortEntity escort = fixtures.escort("restricted");
            commands.restrictWorker(escort.getId(), clock.instant().plus(Duration.ofHours(1)), null);
            Order order = fixtures.openOrder(customer.getId(), 500);

            assertThrows(WorkerRestrictedException.class, () -> commands.applyToOrder(order.getId(), escort.getId()));
            assertTrue(queries.getApplications(order.getId()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Assigning")
    class Assigning {

        @Test
        @DisplayName("Assign binds the applicants and moves the order to ASSIGNED")
        void assignApplicants() {
            EscortEntity first = fixtures.escort("first");
            EscortEntity second = fixtures.escort("second");
            Order order = fixtures.openOrder(customer.getId(), 1000);
            commands.applyToOrder(order.getId(), first.getId());
            commands.applyToOrder(order.getId(), second.getId());

            Order assigned = commands.assignOrder(order.getId(), List.of(second.getId(), first.getId()), null);

            assertEquals(OrderStatus.ASSIGNED, assigned.getStatus());
            assertNull(assigned.getSquadId(), "executors without a common squad");
            List<AssignmentEntity> assignments = assignmentService.getActiveAssignments(order.getId());
            assertEquals(List.of(second.getId(), first.getId()),
                assignments.stream().map(AssignmentEntity::getEscortId).toList());
            assertEquals(List.of(0, 1), assignments.stream().map(AssignmentEntity::getPosition).toList());
        }

        @Test
        @DisplayName("Executors of one squad put the squad on the order")
        void commonSquad() {
            SquadEntity squad = fixtures.squad("ravens");
            EscortEntity a = fixtures.escort("a");
            EscortEntity b = fixtures.escort("b");
            commands.joinSquad(a.getId(), squad.getId());
            commands.joinSquad(b.getId(), squad.getId());

            Order assigned = fixtures.assignedOrder(customer.getId(), 1000, List.of(a.getId(), b.getId()));

            assertEquals(squad.getId(), assigned.getSquadId());
        }

        @Test
        @DisplayName("Escort that never applied cannot be assigned")
        void noSuchApplication() {
            EscortEntity applicant = fixtures.escort("applicant");
            EscortEntity stranger = fixtures.escort("stranger");
            Order order = fixtures.openOrder(customer.getId(), 1000);
            commands.applyToOrder(order.getId(), applicant.getId());

            assertThrows(NoSuchApplicationException.class,
                () -> commands.assignOrder(order.getId(), List.of(applicant.getId(), stranger.getId()), null));
            assertEquals(OrderStatus.OPEN, queries.getOrder(order.getId()).getStatus());
            assertTrue(assignmentService.getActiveAssignments(order.getId()).isEmpty(), "nothing partially assigned");
        }

        @Test
        @DisplayName("Escort restricted after applying cannot be assigned")
        void restrictedAfterApplying() {
            EscortEntity escort = fixtures.escort("banned-later");
            Order order = fixtures.openOrder(customer.getId(), 1000);
            commands.applyToOrder(order.getId(), escort.getId());
            commands.banWorkerPermanently(escort.getId(), null);

            assertThrows(WorkerRestrictedException.class,
                () -> commands.assignOrder(order.getId(), List.of(escort.getId()), null));
        }

        @Test
        @DisplayName("Invalid executor lists are rejected")
        void invalidExecutorLists() {
            Order order = fixtures.openOrder(customer.getId(), 1000);
            UUID id = UUID.randomUUID();

            assertThrows(IllegalArgumentException.class, () -> commands.assignOrder(order.getId(), List.of(), null));
            assertThrows(IllegalArgumentException.class, () -> commands.assignOrder(order.getId(), List.of(id, id), null));
            List<UUID> tooMany = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                UUID.randomUUID(), UUID.randomUUID());
            assertThrows(IllegalArgumentException.class, () -> commands.assignOrder(order.getId(), tooMany, null));
        }

        @Test
        @DisplayName("Assigning an assigned order fails with AlreadyAssigned")
        void alreadyAssigned() {
            EscortEntity first = fixtures.escort("one");
            EscortEntity second = fixtures.escort("two");
            Order order = fixtures.openOrder(customer.getId(), 1000);
            commands.applyToOrder(order.getId(), first.getId());
            commands.applyToOrder(order.getId(), second.getId());
            commands.assignOrder(order.getId(), List.of(first.getId()), null);

            assertThrows(AlreadyAssignedException.class,
                () -> commands.assignOrder(order.getId(), List.of(second.getId()), null));
        }

        @Test
        @DisplayName("Auto-assign picks the earliest eligible applicant")
        void autoAssignSkipsRestricted() {
            EscortEntity early = fixtures.escort("early");
            EscortEntity next = fixtures.escort("next");
            Order order = fixtures.openOrder(customer.getId(), 1000);
            commands.applyToOrder(order.getId(), early.getId());
            commands.applyToOrder(order.getId(), next.getId());
            commands.restrictWorker(early.getId(), clock.instant().plus(Duration.ofDays(1)), null);

            commands.autoAssignOrder(order.getId(), null);

            assertEquals(List.of(next.getId()), assignmentService.getActiveExecutorIds(order.getId()));
        }

        @Test
        @DisplayName("Auto-assign without applicants fails with NoSuchApplication")
        void autoAssignWithoutApplicants() {
            Order order = fixtures.openOrder(customer.getId(), 1000);
            assertThrows(NoSuchApplicationException.class, () -> commands.autoAssignOrder(order.getId(), null));
        }
    }

    @Test
    @DisplayName("Two concurrent assigns of one order: exactly one wins, the other gets AlreadyAssigned")
    void concurrentAssign() throws Exception {
        printTestHeader("Concurrent Assign");
        EscortEntity first = fixtures.escort("racer-1");
        EscortEntity second = fixtures.escort("racer-2");
        Order order = fixtures.openOrder(customer.getId(), 1000);
        commands.applyToOrder(order.getId(), first.getId());
        commands.applyToOrder(order.getId(), second.getId());

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2);
        AtomicInteger succeeded = new AtomicInteger();
        List<Exception> failures = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(2);

        for (EscortEntity escort : List.of(first, second)) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    commands.assignOrder(order.getId(), List.of(escort.getId()), null);
                    succeeded.incrementAndGet();
                } catch (Exception e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Failures", failures);
        assertEquals(1, succeeded.get());
        assertEquals(1, failures.size());
        assertInstanceOf(AlreadyAssignedException.class, failures.get(0));
        assertEquals(1, assignmentService.getActiveAssignments(order.getId()).size());
        assertEquals(OrderStatus.ASSIGNED, queries.getOrder(order.getId()).getStatus());
        printSuccess("Exactly one executor set");
    }

    @Test
    @DisplayName("Concurrent assign and cancel: the order ends CANCELLED with no executor bound")
    void concurrentAssignAndCancel() throws Exception {
        printTestHeader("Concurrent Assign vs Cancel");
        EscortEntity escort = fixtures.escort("racer");
        Order order = fixtures.openOrder(customer.getId(), 1000);
        commands.applyToOrder(order.getId(), escort.getId());

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2);
        AtomicInteger assigned = new AtomicInteger();
        AtomicInteger cancelled = new AtomicInteger();
        List<Exception> failures = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(2);

        executor.submit(() -> {
            try {
                startLatch.await();
                commands.assignOrder(order.getId(), List.of(escort.getId()), null);
                assigned.incrementAndGet();
            } catch (Exception e) {
                failures.add(e);
            } finally {
                doneLatch.countDown();
            }
        });
        executor.submit(() -> {
            try {
                startLatch.await();
                commands.cancelOrder(order.getId(), customer.getId());
                cancelled.incrementAndGet();
            } catch (Exception e) {
                failures.add(e);
            } finally {
                doneLatch.countDown();
            }
        });
        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Assigned", assigned.get());
        printOutput("Failures", failures);
        assertEquals(1, cancelled.get(), "cancel is valid from OPEN and from ASSIGNED");
        assertEquals(OrderStatus.CANCELLED, queries.getOrder(order.getId()).getStatus());
        assertTrue(assignmentService.getActiveAssignments(order.getId()).isEmpty());

        List<AssignmentEntity> all = assignmentService.getAssignments(order.getId());
        if (assigned.get() == 1) {
            assertTrue(failures.isEmpty(), failures.toString());
            assertEquals(1, all.size());
            assertNotNull(all.get(0).getReleasedAt(), "cancel released the executor");
            printSuccess("Assign won, cancel released the executor");
        } else {
            assertEquals(1, failures.size());
            assertInstanceOf(OrderNotOpenException.class, failures.get(0));
            assertTrue(all.isEmpty());
            printSuccess("Cancel won, assign was refused");
        }
    }
}
