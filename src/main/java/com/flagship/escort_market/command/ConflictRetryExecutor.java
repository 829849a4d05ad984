package com.flagship.escort_market.command;

import com.flagship.escort_market.config.MarketplaceProperties;
import com.flagship.escort_market.error.ConflictException;
import com.flagship.escort_market.observability.MarketplaceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a command, retrying it when it lost a race with a concurrent command.
 *
 * Retried: lock timeouts and optimistic version failures ({@link ConcurrencyFailureException}),
 * {@link ConflictException}, and for create-type commands a unique constraint
 * violation from a concurrent insert of the same key. Every attempt is a new
 * transaction. After the last attempt the failure surfaces as {@link ConflictException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConflictRetryExecutor {

    private final MarketplaceProperties properties;
    private final MarketplaceMetrics metrics;

    public <T> T execute(String operation, Supplier<T> command) {
        return execute(operation, command, false);
    }

    /**
     * @param retryOnDuplicateKey also retry unique constraint violations; the next attempt
     *                            finds the row the concurrent command inserted
     */
    public <T> T execute(String operation, Supplier<T> command, boolean retryOnDuplicateKey) {
        MarketplaceProperties.Concurrency settings = properties.getConcurrency();
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        long backoffMs = settings.getInitialBackoffMs();

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return command.get();
            } catch (ConcurrencyFailureException | ConflictException e) {
                lastFailure = e;
            } catch (DataIntegrityViolationException e) {
                if (!retryOnDuplicateKey) {
                    throw e;
                }
                lastFailure = e;
            }

            metrics.recordConflictRetry(operation);
            if (attempt < maxAttempts) {
                log.warn("Conflict in {} (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, backoffMs, lastFailure.getMessage());
                sleep(backoffMs);
                backoffMs = (long) (backoffMs * settings.getBackoffMultiplier());
            }
        }

        log.warn("Giving up on {} after {} attempts", operation, maxAttempts);
        if (lastFailure instanceof ConflictException conflict) {
            throw conflict;
        }
        throw new ConflictException(operation + " failed after " + maxAttempts + " attempts: "
            + lastFailure.getMessage(), lastFailure);
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Interrupted while waiting to retry", e);
        }
    }
}
