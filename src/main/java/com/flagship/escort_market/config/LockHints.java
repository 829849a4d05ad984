package com.flagship.escort_market.config;

/**
 * Query hint values shared by the {@code findByIdForUpdate} finders.
 * Lock waits are bounded; a timeout surfaces as a concurrency failure and then as a conflict.
 * <p>
 * Hibernate's PostgreSQL dialect drops a positive lock timeout hint, so on PostgreSQL the
 * bound comes from the session {@code lock_timeout} set by the pool's connection init SQL.
 */
public final class LockHints {

    public static final String LOCK_TIMEOUT = "jakarta.persistence.lock.timeout";
    public static final String LOCK_TIMEOUT_MS = "3000";

    /** Hibernate's value for {@code SKIP LOCKED}; dialects without support fall back to a plain lock. */
    public static final String SKIP_LOCKED = "-2";

    private LockHints() {
    }
}
