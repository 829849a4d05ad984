package com.flagship.escort_market.order;

/**
 * Order lifecycle states.
 *
 * OPEN → ASSIGNED → IN_PROGRESS → COMPLETED, with OPEN → CANCELLED and ASSIGNED → CANCELLED.
 * COMPLETED and CANCELLED are terminal.
 */
public enum OrderStatus {
    OPEN,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
