package com.flagship.escort_market.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.time.Instant;

/**
 * One line of the orders export: an order joined with one of its payouts.
 * Orders without payouts appear once with empty payout columns.
 */
@Value
@JsonPropertyOrder({"memo_id", "customer", "amount", "commission", "status", "created_at", "finished_at",
    "squad", "payout_amount", "payout_date"})
public class OrderExportRow {
    @JsonProperty("memo_id")
    String memoId;
    @JsonProperty("customer")
    String customer;
    @JsonProperty("amount")
    long amount;
    @JsonProperty("commission")
    long commission;
    @JsonProperty("status")
    String status;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("finished_at")
    Instant finishedAt;
    @JsonProperty("squad")
    String squad;
    @JsonProperty("payout_amount")
    Long payoutAmount;
    @JsonProperty("payout_date")
    Instant payoutDate;
}
