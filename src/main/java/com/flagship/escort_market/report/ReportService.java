package com.flagship.escort_market.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.escort_market.order.OrderStatus;
import com.flagship.escort_market.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Read-only aggregates for operators, computed with plain SQL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();
    private static final CsvSchema EXPORT_SCHEMA = CSV_MAPPER.schemaFor(OrderExportRow.class).withHeader();

    private final JdbcTemplate jdbcTemplate;
    private final UserService userService;

    @Transactional(readOnly = true)
    public PeriodReport periodReport(Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("Report period must satisfy from < to, got [" + from + ", " + to + ")");
        }
        PeriodReport report = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS orders, COALESCE(SUM(o.amount), 0) AS total_amount, " +
            "COALESCE(SUM(o.commission_amount), 0) AS total_commission " +
            "FROM orders o " +
            "WHERE o.status = ? AND o.finished_at >= ? AND o.finished_at < ?",
            (rs, rowNum) -> new PeriodReport(
                from,
                to,
                rs.getLong("orders"),
                rs.getLong("total_amount"),
                rs.getLong("total_commission")
            ),
            OrderStatus.COMPLETED.name(),
            OffsetDateTime.ofInstant(from, ZoneOffset.UTC),
            OffsetDateTime.ofInstant(to, ZoneOffset.UTC)
        );
        log.debug("Period report {}", report);
        return report;
    }

    /**
     * Sum of every payout the user earned as an escort.
     */
    @Transactional(readOnly = true)
    public WorkerEarnings workerEarnings(UUID userId) {
        userService.getUser(userId);
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(p.id) AS orders, COALESCE(SUM(p.amount), 0) AS total_payout, " +
            "COALESCE(SUM(p.commission), 0) AS total_commission " +
            "FROM payouts p JOIN escorts e ON e.id = p.escort_id " +
            "WHERE e.user_id = ?",
            (rs, rowNum) -> new WorkerEarnings(
                userId,
                rs.getLong("orders"),
                rs.getLong("total_payout"),
                rs.getLong("total_commission")
            ),
            userId
        );
    }

    /**
     * Every order with its customer, squad and payouts, oldest first.
     */
    @Transactional(readOnly = true)
    public List<OrderExportRow> exportOrders() {
        return jdbcTemplate.query(
            "SELECT o.memo_id, COALESCE(u.display_name, CAST(u.external_id AS VARCHAR)) AS customer, " +
            "o.amount, o.commission_amount, o.status, o.created_at, o.finished_at, " +
            "s.name AS squad_name, p.amount AS payout_amount, p.created_at AS payout_date " +
            "FROM orders o " +
            "JOIN users u ON u.id = o.customer_id " +
            "LEFT JOIN squads s ON s.id = o.squad_id " +
            "LEFT JOIN payouts p ON p.order_id = o.id " +
            "ORDER BY o.created_at, o.id, p.created_at, p.amount DESC",
            (rs, rowNum) -> new OrderExportRow(
                rs.getString("memo_id"),
                rs.getString("customer"),
                rs.getLong("amount"),
                rs.getLong("commission_amount"),
                rs.getString("status"),
                instant(rs, "created_at"),
                instant(rs, "finished_at"),
                rs.getString("squad_name"),
                rs.getObject("payout_amount", Long.class),
                instant(rs, "payout_date")
            )
        );
    }

    /**
     * {@link #exportOrders()} as CSV with a header line.
     */
    @Transactional(readOnly = true)
    public String exportOrdersCsv() {
        List<OrderExportRow> rows = exportOrders();
        try {
            String csv = CSV_MAPPER.writer(EXPORT_SCHEMA).writeValueAsString(rows);
            log.info("Exported {} order rows", rows.size());
            return csv;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write orders export", e);
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
