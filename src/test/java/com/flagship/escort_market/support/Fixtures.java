package com.flagship.escort_market.support;

import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.escort.EscortEntity;
import com.flagship.escort_market.order.Order;
import com.flagship.escort_market.squad.SquadEntity;
import com.flagship.escort_market.user.UserEntity;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds users, escorts, squads and orders through the command facade.
 * Every name and external id is unique, so tests sharing a database do not collide.
 */
public class Fixtures {

    private static final AtomicLong EXTERNAL_IDS = new AtomicLong(System.nanoTime() % 1_000_000_000L * 1000);

    private final MarketplaceCommandService commands;

    public Fixtures(MarketplaceCommandService commands) {
        this.commands = commands;
    }

    public static String uniqueMemo(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public UserEntity user(String name) {
        return commands.registerUser(EXTERNAL_IDS.incrementAndGet(), name);
    }

    /**
     * An escort with a game account set, ready to apply to orders.
     */
    public EscortEntity escort(String name) {
        EscortEntity escort = commands.registerEscort(user(name).getId());
        return commands.setGameAccount(escort.getId(), "GAME-" + EXTERNAL_IDS.incrementAndGet());
    }

    public SquadEntity squad(String name) {
        return commands.createSquad(name + "-" + UUID.randomUUID().toString().substring(0, 6), null);
    }

    public UserEntity fundedUser(String name, long balance) {
        UserEntity user = user(name);
        commands.adjustBalance(user.getId(), balance, null, "test funding");
        return user;
    }

    public Order openOrder(UUID customerId, long amount) {
        return commands.createOrder(uniqueMemo("order"), customerId, amount, "test order").getOrder();
    }

    /**
     * Creates an order and assigns it to the given escorts, who apply in list order.
     */
    public Order assignedOrder(UUID customerId, long amount, List<UUID> escortIds) {
        Order order = openOrder(customerId, amount);
        escortIds.forEach(escortId -> commands.applyToOrder(order.getId(), escortId));
        return commands.assignOrder(order.getId(), escortIds, null);
    }
}
