package com.flagship.escort_market.settlement;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Even split of an order's net amount and commission across its executors.
 *
 * Remainder units go to the first shares, one each. For every share
 * {@code amount + commission} is that executor's part of the order, and the
 * shares add up to exactly {@code net + commission}.
 */
public final class PayoutSplit {

    private PayoutSplit() {
    }

    @Value
    public static class Share {
        long amount;
        long commission;
    }

    public static List<Share> split(long net, long commission, int executors) {
        if (executors <= 0) {
            throw new IllegalArgumentException("At least one executor is required, got " + executors);
        }
        if (net < 0 || commission < 0) {
            throw new IllegalArgumentException("Negative split input: net=" + net + ", commission=" + commission);
        }
        long[] amounts = distribute(net, executors);
        long[] commissions = distribute(commission, executors);
        List<Share> shares = new ArrayList<>(executors);
        for (int i = 0; i < executors; i++) {
            shares.add(new Share(amounts[i], commissions[i]));
        }
        return shares;
    }

    private static long[] distribute(long total, int parts) {
        long base = total / parts;
        long remainder = total % parts;
        long[] result = new long[parts];
        for (int i = 0; i < parts; i++) {
            result[i] = base + (i < remainder ? 1 : 0);
        }
        return result;
    }
}
