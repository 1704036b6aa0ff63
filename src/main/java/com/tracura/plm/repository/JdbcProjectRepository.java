package com.tracura.plm.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracura.plm.domain.Project;
import com.tracura.plm.domain.ProjectStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ProjectRepository.
 * Conditional writes carry the expected prior value in the WHERE clause, so a lost race
 * updates zero rows instead of overwriting.
 */
@Repository
public class JdbcProjectRepository implements ProjectRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String SELECT = """
        SELECT id, name, status, planned_date, handover_date, initial_handover_date, maintenance_date,
               is_suspended, suspended_date, suspension_reason, team_members, manager_ids,
               temp_approver_id, created_at, updated_at
          FROM projects
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcProjectRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public Optional<Project> findById(String projectId) {
        return jdbc.query(SELECT + " WHERE id = :id", new MapSqlParameterSource("id", projectId), projectRowMapper())
            .stream()
            .findFirst();
    }

    @Override
    public List<Project> findAll() {
        return jdbc.query(SELECT + " ORDER BY created_at DESC", projectRowMapper());
    }

    @Override
    public Project insert(Project project) {
        var params = new MapSqlParameterSource()
            .addValue("id", project.id())
            .addValue("name", project.name())
            .addValue("status", project.status())
            .addValue("plannedDate", StoreDates.format(project.plannedDate()))
            .addValue("handoverDate", StoreDates.format(project.handoverDate()))
            .addValue("initialHandoverDate", StoreDates.format(project.initialHandoverDate()))
            .addValue("maintenanceDate", StoreDates.format(project.maintenanceDate()))
            .addValue("suspended", project.suspended() ? 1 : 0)
            .addValue("suspendedDate", StoreDates.format(project.suspendedDate()))
            .addValue("suspensionReason", project.suspensionReason().orElse(null))
            .addValue("teamMembers", json.write(List.copyOf(project.teamMembers())))
            .addValue("managerIds", json.write(project.managerIds()))
            .addValue("tempApproverId", project.tempApproverId().orElse(null))
            .addValue("createdAt", project.createdAt().map(Timestamp::valueOf).orElse(null))
            .addValue("updatedAt", project.updatedAt().map(Timestamp::valueOf).orElse(null));

        jdbc.update("""
            INSERT INTO projects (id, name, status, planned_date, handover_date, initial_handover_date,
                                  maintenance_date, is_suspended, suspended_date, suspension_reason,
                                  team_members, manager_ids, temp_approver_id, created_at, updated_at)
            VALUES (:id, :name, :status, :plannedDate, :handoverDate, :initialHandoverDate,
                    :maintenanceDate, :suspended, :suspendedDate, :suspensionReason,
                    :teamMembers, :managerIds, :tempApproverId, :createdAt, :updatedAt)
            """, params);
        return project;
    }

    @Override
    public boolean updateStatus(String projectId, String expectedStatus, ProjectStatus newStatus, LocalDateTime at) {
        var params = new MapSqlParameterSource()
            .addValue("id", projectId)
            .addValue("expected", expectedStatus)
            .addValue("newStatus", newStatus.name())
            .addValue("updatedAt", Timestamp.valueOf(at));
        return jdbc.update(
            "UPDATE projects SET status = :newStatus, updated_at = :updatedAt WHERE id = :id AND "
                + expectedStatusClause(expectedStatus),
            params
        ) == 1;
    }

    @Override
    public boolean unsuspend(String projectId, String expectedStatus, ProjectStatus newStatus, LocalDateTime at) {
        var params = new MapSqlParameterSource()
            .addValue("id", projectId)
            .addValue("expected", expectedStatus)
            .addValue("newStatus", newStatus.name())
            .addValue("updatedAt", Timestamp.valueOf(at));
        return jdbc.update(
            """
            UPDATE projects
               SET status = :newStatus, is_suspended = 0, suspended_date = NULL,
                   suspension_reason = NULL, updated_at = :updatedAt
             WHERE id = :id AND is_suspended = 1
            """ + " AND " + expectedStatusClause(expectedStatus),
            params
        ) == 1;
    }

    @Override
    public boolean assignTempApprover(String projectId, String approverId, LocalDateTime at) {
        var params = new MapSqlParameterSource()
            .addValue("id", projectId)
            .addValue("approverId", approverId)
            .addValue("updatedAt", Timestamp.valueOf(at));
        return jdbc.update("""
            UPDATE projects SET temp_approver_id = :approverId, updated_at = :updatedAt
             WHERE id = :id AND temp_approver_id IS NULL
            """, params) == 1;
    }

    @Override
    public boolean clearTempApprover(String projectId, String approverId) {
        var params = new MapSqlParameterSource()
            .addValue("id", projectId)
            .addValue("approverId", approverId);
        return jdbc.update("""
            UPDATE projects SET temp_approver_id = NULL
             WHERE id = :id AND temp_approver_id = :approverId
            """, params) == 1;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    // Compare against the text as read; legacy and padded values must match exactly
    private static String expectedStatusClause(String expectedStatus) {
        return expectedStatus == null ? "status IS NULL" : "status = :expected";
    }

    private RowMapper<Project> projectRowMapper() {
        return (rs, rowNum) -> mapResultSetToProject(rs);
    }

    private Project mapResultSetToProject(ResultSet rs) throws SQLException {
        return new Project(
            rs.getString("ID"),
            rs.getString("NAME"),
            rs.getString("STATUS"),
            StoreDates.parse(rs.getString("PLANNED_DATE")),
            StoreDates.parse(rs.getString("HANDOVER_DATE")),
            StoreDates.parse(rs.getString("INITIAL_HANDOVER_DATE")),
            StoreDates.parse(rs.getString("MAINTENANCE_DATE")),
            rs.getInt("IS_SUSPENDED") == 1,
            StoreDates.parse(rs.getString("SUSPENDED_DATE")),
            Optional.ofNullable(rs.getString("SUSPENSION_REASON")),
            new LinkedHashSet<>(json.read(rs.getString("TEAM_MEMBERS"), STRING_LIST, List.of())),
            json.read(rs.getString("MANAGER_IDS"), STRING_LIST, List.of()),
            Optional.ofNullable(rs.getString("TEMP_APPROVER_ID")),
            Optional.ofNullable(rs.getTimestamp("CREATED_AT")).map(Timestamp::toLocalDateTime),
            Optional.ofNullable(rs.getTimestamp("UPDATED_AT")).map(Timestamp::toLocalDateTime)
        );
    }
}
