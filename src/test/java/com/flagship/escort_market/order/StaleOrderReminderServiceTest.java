package com.flagship.escort_market.order;

import com.flagship.escort_market.audit.ActionLogEntry;
import com.flagship.escort_market.audit.ActionType;
import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.command.MarketplaceQueryService;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.order.event.OrderEvent;
import com.flagship.escort_market.order.event.OrderReminderEvent;
import com.flagship.escort_market.outbox.OutboxService;
import com.flagship.escort_market.support.Fixtures;
import com.flagship.escort_market.support.MutableClock;
import com.flagship.escort_market.support.TestClockConfig;
import com.flagship.escort_market.user.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class StaleOrderReminderServiceTest {

    @Autowired
    private MarketplaceCommandService commands;

    @Autowired
    private MarketplaceQueryService queries;

    @Autowired
    private StaleOrderReminderService reminderService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private MutableClock clock;

    private Fixtures fixtures;
    private UserEntity customer;

    @BeforeEach
    void setUp() {
        fixtures = new Fixtures(commands);
        customer = fixtures.user("customer");
    }

    private long remindersFor(Order order) {
        return queries.getActionLogForOrder(order.getId()).stream()
            .map(ActionLogEntry::getActionType)
            .filter(ActionType.REMINDER_SENT::equals)
            .count();
    }

    @Test
    @DisplayName("Running order past the threshold is reminded once per window")
    void remindsOncePerWindow() {
        EscortEntity escort = fixtures.escort("slowpoke");
        Order running = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));

        reminderService.remindStaleOrders();
        assertEquals(0, remindersFor(running), "fresh order is not stale");

        clock.advance(Duration.ofHours(13));
        assertTrue(reminderService.remindStaleOrders() >= 1);
        assertEquals(1, remindersFor(running));

        reminderService.remindStaleOrders();
        assertEquals(1, remindersFor(running), "no second reminder within the window");

        clock.advance(Duration.ofHours(13));
        reminderService.remindStaleOrders();
        assertEquals(2, remindersFor(running));

        long events = outboxService.getEventsForAggregate(OrderEvent.AGGREGATE_TYPE, running.getId()).stream()
            .filter(e -> e.getEventType().equals(OrderReminderEvent.EVENT_TYPE))
            .count();
        assertEquals(2, events);
    }

    @Test
    @DisplayName("Open and finished orders are never reminded")
    void onlyRunningOrders() {
        EscortEntity escort = fixtures.escort("done");
        Order open = fixtures.openOrder(customer.getId(), 1000);
        Order done = fixtures.assignedOrder(customer.getId(), 1000, List.of(escort.getId()));
        commands.completeOrder(done.getId(), null, null);

        clock.advance(Duration.ofHours(13));
        reminderService.remindStaleOrders();

        assertEquals(0, remindersFor(open));
        assertEquals(0, remindersFor(done));
    }
}
