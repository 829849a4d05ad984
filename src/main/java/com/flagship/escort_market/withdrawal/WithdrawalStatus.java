package com.flagship.escort_market.withdrawal;

public enum WithdrawalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
