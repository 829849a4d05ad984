package com.flagship.escort_market.error;

/**
 * Raised when a memo id is reused for an order whose content differs from the stored one.
 * Identical retries return the stored order instead.
 */
public class DuplicateOrderException extends MarketplaceException {

    public DuplicateOrderException(String memoId) {
        super(ErrorCode.DUPLICATE_ORDER, "Order with memo id " + memoId + " already exists with different content");
    }
}
