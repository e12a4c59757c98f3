package com.flagship.expense_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_ledger.balance.MonthlyBalance;
import com.flagship.expense_ledger.transaction.ActivityLogEntry;
import com.flagship.expense_ledger.transaction.Category;
import com.flagship.expense_ledger.transaction.Payer;
import com.flagship.expense_ledger.transaction.PaymentMode;
import com.flagship.expense_ledger.transaction.SplitDetails;
import com.flagship.expense_ledger.transaction.Transaction;
import com.flagship.expense_ledger.transaction.TransactionFilter;
import com.flagship.expense_ledger.transaction.TransactionType;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * {@link LedgerStore} on PostgreSQL through plain JDBC.
 *
 * Payers, split details and the activity log are stored as jsonb documents using the
 * snake_case field names of the API. Queries by participant use jsonb containment so
 * the GIN indexes on those columns apply.
 */
@Repository
public class JdbcLedgerStore implements LedgerStore {

    private static final TypeReference<List<Payer>> PAYERS = new TypeReference<>() {};
    private static final TypeReference<List<ActivityLogEntry>> ACTIVITY_LOG = new TypeReference<>() {};

    private static final String TRANSACTION_COLUMNS =
        "id, user_id, type, amount, payment_mode, description, date, category, " +
        "payers, split_details, activity_log, created_at, updated_at, deleted_at";

    private static final String INVOLVES_USER =
        "(t.user_id = ? OR t.payers @> ?::jsonb OR t.split_details -> 'participants' @> ?::jsonb)";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Transaction upsertTransaction(Transaction transaction, String idempotencyKey) {
        jdbcTemplate.update(
            "INSERT INTO transactions (" + TRANSACTION_COLUMNS + ", idempotency_key) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?) " +
            "ON CONFLICT (id) DO UPDATE SET " +
            "type = EXCLUDED.type, amount = EXCLUDED.amount, payment_mode = EXCLUDED.payment_mode, " +
            "description = EXCLUDED.description, date = EXCLUDED.date, category = EXCLUDED.category, " +
            "payers = EXCLUDED.payers, split_details = EXCLUDED.split_details, " +
            "activity_log = EXCLUDED.activity_log, updated_at = EXCLUDED.updated_at, " +
            "deleted_at = EXCLUDED.deleted_at",
            transaction.getId(),
            transaction.getUserId(),
            transaction.getType().value(),
            transaction.getAmount(),
            transaction.getPaymentMode().value(),
            transaction.getDescription(),
            timestamp(transaction.getDate()),
            transaction.getCategory() != null ? transaction.getCategory().value() : null,
            toJson(transaction.getPayers()),
            transaction.getSplitDetails() != null ? toJson(transaction.getSplitDetails()) : null,
            toJson(transaction.getActivityLog()),
            timestamp(transaction.getCreatedAt()),
            timestamp(transaction.getUpdatedAt()),
            timestamp(transaction.getDeletedAt()),
            idempotencyKey
        );
        return transaction;
    }

    @Override
    public Optional<Transaction> findTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE id = ?",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    @Override
    public Optional<Transaction> findTransactionForUpdate(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE id = ? FOR UPDATE",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    @Override
    public Optional<Transaction> findTransactionByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE idempotency_key = ?",
            transactionRowMapper(),
            idempotencyKey
        ).stream().findFirst();
    }

    @Override
    public List<Transaction> queryTransactions(UUID userId, TransactionFilter filter) {
        String userMatch = toJson(List.of(Map.of("user_id", userId.toString())));
        StringBuilder sql = new StringBuilder("SELECT " + TRANSACTION_COLUMNS + " FROM transactions t WHERE ")
            .append(INVOLVES_USER);
        List<Object> args = new ArrayList<>(List.of(userId, userMatch, userMatch));

        if (!filter.isIncludeDeleted()) {
            sql.append(" AND t.deleted_at IS NULL");
        }
        if (filter.getFrom() != null) {
            sql.append(" AND t.date >= ?");
            args.add(timestamp(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            sql.append(" AND t.date < ?");
            args.add(timestamp(filter.getTo()));
        }
        if (filter.getType() != null) {
            sql.append(" AND t.type = ?");
            args.add(filter.getType().value());
        }
        sql.append(" ORDER BY t.date DESC, t.created_at DESC");

        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());
    }

    @Override
    public void replaceEdges(UUID transactionId, List<DebtEdge> edges) {
        jdbcTemplate.update("DELETE FROM debts WHERE transaction_id = ?", transactionId);
        if (edges.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO debts (id, transaction_id, debtor_id, creditor_id, amount, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            edges,
            edges.size(),
            (ps, edge) -> {
                ps.setObject(1, edge.getTransactionId());
                ps.setObject(2, edge.getDebtorId());
                ps.setObject(3, edge.getCreditorId());
                ps.setBigDecimal(4, edge.getAmount());
            }
        );
    }

    @Override
    public List<DebtEdge> findEdgesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT transaction_id, debtor_id, creditor_id, amount FROM debts " +
            "WHERE transaction_id = ? ORDER BY amount DESC, debtor_id, creditor_id",
            edgeRowMapper(),
            transactionId
        );
    }

    @Override
    public List<DebtEdge> queryEdges(UUID userId) {
        return jdbcTemplate.query(
            "SELECT transaction_id, debtor_id, creditor_id, amount FROM debts " +
            "WHERE debtor_id = ? OR creditor_id = ?",
            edgeRowMapper(),
            userId,
            userId
        );
    }

    @Override
    public void upsertMonthlyBalance(MonthlyBalance balance) {
        jdbcTemplate.update(
            "INSERT INTO monthly_balances (id, user_id, month_year, opening_balance, closing_balance, " +
            "created_at, updated_at) VALUES (gen_random_uuid(), ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (user_id, month_year) DO UPDATE SET " +
            "opening_balance = EXCLUDED.opening_balance, closing_balance = EXCLUDED.closing_balance, " +
            "updated_at = CURRENT_TIMESTAMP",
            balance.getUserId(),
            balance.getMonth().toString(),
            balance.getOpeningBalance(),
            balance.getClosingBalance()
        );
    }

    @Override
    public int deleteMonthlyBalancesExcept(UUID userId, Set<YearMonth> keep) {
        if (keep.isEmpty()) {
            return jdbcTemplate.update("DELETE FROM monthly_balances WHERE user_id = ?", userId);
        }
        String[] months = keep.stream().map(YearMonth::toString).toArray(String[]::new);
        return jdbcTemplate.update(
            "DELETE FROM monthly_balances WHERE user_id = ? AND NOT (month_year = ANY (?))",
            ps -> {
                ps.setObject(1, userId);
                ps.setArray(2, ps.getConnection().createArrayOf("varchar", months));
            }
        );
    }

    @Override
    public Optional<MonthlyBalance> findMonthlyBalance(UUID userId, YearMonth month) {
        return jdbcTemplate.query(
            "SELECT user_id, month_year, opening_balance, closing_balance FROM monthly_balances " +
            "WHERE user_id = ? AND month_year = ?",
            monthlyBalanceRowMapper(),
            userId,
            month.toString()
        ).stream().findFirst();
    }

    @Override
    public List<MonthlyBalance> findMonthlyBalances(UUID userId) {
        return jdbcTemplate.query(
            "SELECT user_id, month_year, opening_balance, closing_balance FROM monthly_balances " +
            "WHERE user_id = ? ORDER BY month_year",
            monthlyBalanceRowMapper(),
            userId
        );
    }

    private RowMapper<Transaction> transactionRowMapper() {
        return (rs, rowNum) -> Transaction.builder()
            .id(rs.getObject("id", UUID.class))
            .userId(rs.getObject("user_id", UUID.class))
            .type(TransactionType.fromValue(rs.getString("type")))
            .amount(rs.getBigDecimal("amount"))
            .paymentMode(PaymentMode.fromValue(rs.getString("payment_mode")))
            .description(rs.getString("description"))
            .date(instant(rs, "date"))
            .category(Category.fromValue(rs.getString("category")))
            .payers(fromJson(rs.getString("payers"), PAYERS))
            .splitDetails(splitDetails(rs.getString("split_details")))
            .activityLog(fromJson(rs.getString("activity_log"), ACTIVITY_LOG))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .deletedAt(instant(rs, "deleted_at"))
            .build();
    }

    private RowMapper<DebtEdge> edgeRowMapper() {
        return (rs, rowNum) -> new DebtEdge(
            rs.getObject("transaction_id", UUID.class),
            rs.getObject("debtor_id", UUID.class),
            rs.getObject("creditor_id", UUID.class),
            rs.getBigDecimal("amount")
        );
    }

    private RowMapper<MonthlyBalance> monthlyBalanceRowMapper() {
        return (rs, rowNum) -> new MonthlyBalance(
            rs.getObject("user_id", UUID.class),
            YearMonth.parse(rs.getString("month_year")),
            rs.getBigDecimal("opening_balance"),
            rs.getBigDecimal("closing_balance")
        );
    }

    private SplitDetails splitDetails(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, SplitDetails.class);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable split_details column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable jsonb column", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize ledger document", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value != null ? value.toInstant() : null;
    }
}
