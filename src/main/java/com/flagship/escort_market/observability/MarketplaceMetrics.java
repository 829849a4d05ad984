package com.flagship.escort_market.observability;

import com.flagship.escort_market.ledger.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for marketplace operations.
 *
 * Metrics exposed:
 * - marketplace.orders.created: orders created, tagged by result
 * - marketplace.orders.transitions: lifecycle transitions, tagged by target status
 * - marketplace.settlement.duration: time spent settling an order
 * - marketplace.ledger.postings / marketplace.ledger.volume: ledger activity per transaction type
 * - marketplace.commands.conflicts: conflict retries in the command facade
 */
@Component
public class MarketplaceMetrics {

    private final MeterRegistry registry;

    private final Counter settlementsReplayed;
    private final Timer settlementTimer;

    public MarketplaceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.settlementsReplayed = Counter.builder("marketplace.settlement.replayed")
                .description("Settlement calls answered from existing payouts")
                .register(registry);

        this.settlementTimer = Timer.builder("marketplace.settlement.duration")
                .description("Time taken to settle an order")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordOrderCreated(String result) {
        registry.counter("marketplace.orders.created", "result", sanitizeTag(result)).increment();
    }

    public void recordTransition(String status) {
        registry.counter("marketplace.orders.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordSettlement(Duration duration) {
        settlementTimer.record(duration);
    }

    public void recordSettlementReplayed() {
        settlementsReplayed.increment();
    }

    public void recordLedgerPosted(TransactionType type, long signedAmount) {
        registry.counter("marketplace.ledger.postings", "type", type.name()).increment();
        registry.counter("marketplace.ledger.volume", "type", type.name()).increment(Math.abs(signedAmount));
    }

    public void recordLedgerRejected(TransactionType type) {
        registry.counter("marketplace.ledger.rejected", "type", type.name()).increment();
    }

    public void recordWithdrawal(String outcome) {
        registry.counter("marketplace.withdrawals", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordApplication(String result) {
        registry.counter("marketplace.applications", "result", sanitizeTag(result)).increment();
    }

    public void recordConflictRetry(String operation) {
        registry.counter("marketplace.commands.conflicts", "operation", sanitizeTag(operation)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordReminderSent() {
        registry.counter("marketplace.reminders.sent").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
