package com.tracura.plm.repository;

import com.tracura.plm.domain.TempApprover;
import com.tracura.plm.domain.TempApproverStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of TempApproverRepository.
 */
@Repository
public class JdbcTempApproverRepository implements TempApproverRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTempApproverRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTempApproverRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<TempApprover> find(String projectId, String approverId) {
        var params = new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("approverId", approverId);
        var rows = jdbc.query("""
            SELECT id, project_id, approver_id, start_date, end_date, status, rejection_reason, updated_at
              FROM temp_approvers
             WHERE project_id = :projectId AND approver_id = :approverId
             ORDER BY created_at DESC
            """, params, (rs, rowNum) -> mapResultSetToTempApprover(rs));
        return rows.stream().findFirst();
    }

    @Override
    public TempApprover insert(TempApprover tempApprover) {
        var id = tempApprover.id().orElseGet(() -> UUID.randomUUID().toString());
        var at = tempApprover.updatedAt().map(Timestamp::valueOf).orElse(null);
        var params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("projectId", tempApprover.projectId())
            .addValue("approverId", tempApprover.approverId())
            .addValue("startDate", Timestamp.valueOf(tempApprover.startDate()))
            .addValue("endDate", Timestamp.valueOf(tempApprover.endDate()))
            .addValue("status", tempApprover.status().name())
            .addValue("reason", tempApprover.rejectionReason().orElse(null))
            .addValue("createdAt", at)
            .addValue("updatedAt", at);
        jdbc.update("""
            INSERT INTO temp_approvers (id, project_id, approver_id, start_date, end_date, status,
                                        rejection_reason, created_at, updated_at)
            VALUES (:id, :projectId, :approverId, :startDate, :endDate, :status, :reason, :createdAt, :updatedAt)
            """, params);
        return tempApprover.withId(id);
    }

    @Override
    public boolean updateStatus(
        String projectId, String approverId, TempApproverStatus expected,
        TempApproverStatus newStatus, String reason, LocalDateTime at
    ) {
        var current = find(projectId, approverId);
        if (current.isEmpty() || current.get().id().isEmpty()) {
            log.warn("No delegation of {} on project {} to update", approverId, projectId);
            return false;
        }
        var params = new MapSqlParameterSource()
            .addValue("id", current.get().id().get())
            .addValue("expected", expected.name())
            .addValue("status", newStatus.name())
            .addValue("reason", reason)
            .addValue("updatedAt", Timestamp.valueOf(at));
        var reasonColumn = reason == null ? "" : ", rejection_reason = :reason";
        return jdbc.update(
            "UPDATE temp_approvers SET status = :status, updated_at = :updatedAt" + reasonColumn
                + " WHERE id = :id AND status = :expected",
            params
        ) == 1;
    }

    @Override
    public void addApprovedExpense(String tempApproverId, String expenseId) {
        var params = new MapSqlParameterSource()
            .addValue("tempApproverId", tempApproverId)
            .addValue("expenseId", expenseId);
        jdbc.update("""
            INSERT INTO temp_approver_expenses (temp_approver_id, expense_id)
            SELECT :tempApproverId, :expenseId FROM dual
             WHERE NOT EXISTS (SELECT 1 FROM temp_approver_expenses
                                WHERE temp_approver_id = :tempApproverId AND expense_id = :expenseId)
            """, params);
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private TempApprover mapResultSetToTempApprover(ResultSet rs) throws SQLException {
        var id = rs.getString("ID");
        var status = TempApproverStatus.fromStored(rs.getString("STATUS"))
            .orElse(TempApproverStatus.EXPIRED);
        return new TempApprover(
            Optional.of(id),
            rs.getString("PROJECT_ID"),
            rs.getString("APPROVER_ID"),
            rs.getTimestamp("START_DATE").toLocalDateTime(),
            rs.getTimestamp("END_DATE").toLocalDateTime(),
            status,
            approvedExpenses(id),
            Optional.ofNullable(rs.getString("REJECTION_REASON")),
            Optional.ofNullable(rs.getTimestamp("UPDATED_AT")).map(Timestamp::toLocalDateTime)
        );
    }

    private List<String> approvedExpenses(String tempApproverId) {
        return jdbc.queryForList(
            "SELECT expense_id FROM temp_approver_expenses WHERE temp_approver_id = :id ORDER BY expense_id",
            new MapSqlParameterSource("id", tempApproverId),
            String.class
        );
    }
}
