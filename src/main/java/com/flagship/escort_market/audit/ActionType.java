package com.flagship.escort_market.audit;

public enum ActionType {
    USER_REGISTERED,
    ESCORT_REGISTERED,
    ESCORT_PROFILE_UPDATED,
    SQUAD_CREATED,
    SQUAD_JOINED,
    SQUAD_LEFT,
    SQUAD_DISBANDED,
    ORDER_CREATED,
    APPLICATION_SUBMITTED,
    ORDER_ASSIGNED,
    ORDER_STARTED,
    ORDER_COMPLETED,
    ORDER_CANCELLED,
    ORDER_RATED,
    REMINDER_SENT,
    RATING_RECORDED,
    WORKER_BANNED,
    WORKER_RESTRICTED,
    WORKER_UNRESTRICTED,
    WITHDRAWAL_REQUESTED,
    WITHDRAWAL_APPROVED,
    WITHDRAWAL_REJECTED,
    BALANCE_ADJUSTED,
    BALANCE_ZEROED,
    COMPLAINT_FILED
}
