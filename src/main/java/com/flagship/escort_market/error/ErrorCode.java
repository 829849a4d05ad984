package com.flagship.escort_market.error;

/**
 * Failure categories returned to callers of the marketplace core.
 * Only {@link #CONFLICT} is retried by the command facade.
 */
public enum ErrorCode {
    NOT_FOUND,
    DUPLICATE_ORDER,
    DUPLICATE_APPLICATION,
    DUPLICATE_SQUAD,
    ORDER_NOT_OPEN,
    INVALID_TRANSITION,
    ALREADY_ASSIGNED,
    NO_SUCH_APPLICATION,
    APPLICATION_LIMIT_REACHED,
    WORKER_RESTRICTED,
    GAME_ACCOUNT_REQUIRED,
    INSUFFICIENT_BALANCE,
    CONFLICT
}
