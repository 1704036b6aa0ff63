package com.tracura.plm.repository;

import com.tracura.plm.domain.Expense;
import com.tracura.plm.domain.ExpenseStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ExpenseRepository.
 */
@Repository
public class JdbcExpenseRepository implements ExpenseRepository {

    private static final String SELECT = """
        SELECT id, project_id, phase_id, department, expense_date, amount, status, is_admin,
               submitted_by, approved_by, rejected_by, remark, created_at, updated_at
          FROM expenses
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcExpenseRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Expense> findApproved(String projectId) {
        var params = new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("status", ExpenseStatus.APPROVED.name());
        return jdbc.query(SELECT + " WHERE project_id = :projectId AND status = :status", params, expenseRowMapper());
    }

    @Override
    public Optional<Expense> findById(String projectId, String expenseId) {
        var params = new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("id", expenseId);
        return jdbc.query(SELECT + " WHERE project_id = :projectId AND id = :id", params, expenseRowMapper())
            .stream()
            .findFirst();
    }

    @Override
    public Expense insert(Expense expense) {
        var id = expense.id().orElseGet(() -> UUID.randomUUID().toString());
        var params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("projectId", expense.projectId())
            .addValue("phaseId", expense.phaseId().orElse(null))
            .addValue("department", expense.department())
            .addValue("expenseDate", StoreDates.format(expense.date()))
            .addValue("amount", expense.amount())
            .addValue("status", expense.status().name())
            .addValue("admin", expense.admin() ? 1 : 0)
            .addValue("submittedBy", expense.submittedBy())
            .addValue("approvedBy", expense.approvedBy().orElse(null))
            .addValue("rejectedBy", expense.rejectedBy().orElse(null))
            .addValue("remark", expense.remark().orElse(null))
            .addValue("createdAt", expense.createdAt().map(Timestamp::valueOf).orElse(null))
            .addValue("updatedAt", expense.updatedAt().map(Timestamp::valueOf).orElse(null));
        jdbc.update("""
            INSERT INTO expenses (id, project_id, phase_id, department, expense_date, amount, status, is_admin,
                                  submitted_by, approved_by, rejected_by, remark, created_at, updated_at)
            VALUES (:id, :projectId, :phaseId, :department, :expenseDate, :amount, :status, :admin,
                    :submittedBy, :approvedBy, :rejectedBy, :remark, :createdAt, :updatedAt)
            """, params);
        return expense.withId(id);
    }

    @Override
    public boolean updateDecision(Expense decided, ExpenseStatus expected) {
        var id = decided.id().orElseThrow(() -> new IllegalArgumentException("Expense id is required"));
        var params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("projectId", decided.projectId())
            .addValue("expected", expected.name())
            .addValue("status", decided.status().name())
            .addValue("approvedBy", decided.approvedBy().orElse(null))
            .addValue("rejectedBy", decided.rejectedBy().orElse(null))
            .addValue("remark", decided.remark().orElse(null))
            .addValue("updatedAt", decided.updatedAt().map(Timestamp::valueOf).orElse(null));
        return jdbc.update("""
            UPDATE expenses
               SET status = :status, approved_by = :approvedBy, rejected_by = :rejectedBy,
                   remark = :remark, updated_at = :updatedAt
             WHERE id = :id AND project_id = :projectId AND status = :expected
            """, params) == 1;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private RowMapper<Expense> expenseRowMapper() {
        return (rs, rowNum) -> mapResultSetToExpense(rs);
    }

    private Expense mapResultSetToExpense(ResultSet rs) throws SQLException {
        return new Expense(
            Optional.ofNullable(rs.getString("ID")),
            rs.getString("PROJECT_ID"),
            Optional.ofNullable(rs.getString("PHASE_ID")),
            rs.getString("DEPARTMENT"),
            StoreDates.parse(rs.getString("EXPENSE_DATE")).orElse(null),
            rs.getBigDecimal("AMOUNT"),
            ExpenseStatus.valueOf(rs.getString("STATUS")),
            rs.getInt("IS_ADMIN") == 1,
            rs.getString("SUBMITTED_BY"),
            Optional.ofNullable(rs.getString("APPROVED_BY")),
            Optional.ofNullable(rs.getString("REJECTED_BY")),
            Optional.ofNullable(rs.getString("REMARK")),
            Optional.ofNullable(rs.getTimestamp("CREATED_AT")).map(Timestamp::toLocalDateTime),
            Optional.ofNullable(rs.getTimestamp("UPDATED_AT")).map(Timestamp::toLocalDateTime)
        );
    }
}
