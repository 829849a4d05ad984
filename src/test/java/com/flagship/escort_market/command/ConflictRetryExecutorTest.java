package com.flagship.escort_market.command;

import com.flagship.escort_market.config.MarketplaceProperties;
import com.flagship.escort_market.error.ConflictException;
import com.flagship.escort_market.error.InsufficientBalanceException;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.ArgumentMatchers.anyString;

class ConflictRetryExecutorTest {

    private MarketplaceMetrics metrics;
    private ConflictRetryExecutor executor;

    @BeforeEach
    void setUp() {
        MarketplaceProperties properties = new MarketplaceProperties();
        properties.getConcurrency().setMaxAttempts(3);
        properties.getConcurrency().setInitialBackoffMs(1);
        metrics = mock(MarketplaceMetrics.class);
        executor = new ConflictRetryExecutor(properties, metrics);
    }

    @Test
    @DisplayName("Lock timeout is retried until the command succeeds")
    void retriesLockTimeout() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new PessimisticLockingFailureException("lock timeout");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, calls.get());
        verify(metrics, times(2)).recordConflictRetry("op");
    }

    @Test
    @DisplayName("Persistent conflict surfaces as ConflictException after the last attempt")
    void givesUp() {
        AtomicInteger calls = new AtomicInteger();

        ConflictException e = assertThrows(ConflictException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            throw new ObjectOptimisticLockingFailureException(Object.class, UUID.randomUUID());
        }));

        assertEquals(3, calls.get());
        assertInstanceOf(ObjectOptimisticLockingFailureException.class, e.getCause());
    }

    @Test
    @DisplayName("Business errors are not retried")
    void businessErrorsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(InsufficientBalanceException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            throw new InsufficientBalanceException(UUID.randomUUID(), 10, 20);
        }));

        assertEquals(1, calls.get());
        verify(metrics, never()).recordConflictRetry(anyString());
    }

    @Test
    @DisplayName("Duplicate key is retried only for create-type commands")
    void duplicateKeyOnlyForCreates() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(DataIntegrityViolationException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        }));
        assertEquals(1, calls.get());

        AtomicInteger createCalls = new AtomicInteger();
        String result = executor.execute("create", () -> {
            if (createCalls.incrementAndGet() == 1) {
                throw new DataIntegrityViolationException("duplicate key");
            }
            return "existing";
        }, true);
        assertEquals("existing", result);
        assertEquals(2, createCalls.get());
    }
}
