package com.flagship.escort_market.api;

import com.flagship.escort_market.api.dto.BalanceMismatchResponse;
import com.flagship.escort_market.api.dto.PeriodReportResponse;
import com.flagship.escort_market.command.MarketplaceQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Operator reports.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv;charset=UTF-8");

    private final MarketplaceQueryService queries;
    private final Clock clock;

    /**
     * Completed orders in [from, to), ISO-8601 instants.
     */
    @GetMapping("/period")
    public PeriodReportResponse periodReport(@RequestParam("from") Instant from, @RequestParam("to") Instant to) {
        return PeriodReportResponse.from(queries.periodReport(from, to));
    }

    /**
     * Users whose balance disagrees with their transactions. Empty when the ledger is consistent.
     */
    @GetMapping("/ledger-mismatches")
    public List<BalanceMismatchResponse> ledgerMismatches() {
        return queries.verifyBalances().stream().map(BalanceMismatchResponse::from).toList();
    }

    /**
     * Every order with its payouts as a CSV download.
     */
    @GetMapping("/orders-export")
    public ResponseEntity<String> exportOrders() {
        String filename = "orders_export_" + FILE_STAMP.format(Instant.now(clock)) + ".csv";
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
            .contentType(TEXT_CSV)
            .body(queries.exportOrdersCsv());
    }
}
