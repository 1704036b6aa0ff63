package com.tracura.plm.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracura.plm.domain.ContractorMode;
import com.tracura.plm.domain.Department;
import com.tracura.plm.domain.DepartmentLineItem;
import com.tracura.plm.domain.Phase;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of PhaseRepository.
 * Legacy phase budgets and department line items are stored as JSON documents.
 */
@Repository
public class JdbcPhaseRepository implements PhaseRepository {

    private static final TypeReference<Map<String, BigDecimal>> BUDGET_MAP = new TypeReference<>() {};
    private static final TypeReference<List<DepartmentLineItem>> LINE_ITEMS = new TypeReference<>() {};

    private static final String SELECT_PHASE = """
        SELECT id, project_id, phase_name, phase_number, start_date, end_date, is_enabled, legacy_budgets
          FROM phases
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcPhaseRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public List<Phase> findPhases(String projectId) {
        return jdbc.query(
            SELECT_PHASE + " WHERE project_id = :projectId ORDER BY phase_number",
            new MapSqlParameterSource("projectId", projectId),
            phaseRowMapper()
        );
    }

    @Override
    public Optional<Phase> findPhase(String projectId, String phaseId) {
        var params = new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("id", phaseId);
        return jdbc.query(SELECT_PHASE + " WHERE project_id = :projectId AND id = :id", params, phaseRowMapper())
            .stream()
            .findFirst();
    }

    @Override
    public List<Department> findDepartments(String projectId, String phaseId) {
        var params = new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("phaseId", phaseId);
        return jdbc.query("""
            SELECT id, project_id, phase_id, name, contractor_mode, line_items
              FROM departments
             WHERE project_id = :projectId AND phase_id = :phaseId
             ORDER BY name
            """, params, departmentRowMapper());
    }

    @Override
    public Phase insertPhase(Phase phase) {
        var params = new MapSqlParameterSource()
            .addValue("id", phase.id())
            .addValue("projectId", phase.projectId())
            .addValue("phaseName", phase.phaseName())
            .addValue("phaseNumber", phase.phaseNumber())
            .addValue("startDate", StoreDates.format(phase.startDate()))
            .addValue("endDate", StoreDates.format(phase.endDate()))
            .addValue("enabled", phase.enabled() ? 1 : 0)
            .addValue("legacyBudgets", json.write(phase.legacyBudgets()));
        jdbc.update("""
            INSERT INTO phases (id, project_id, phase_name, phase_number, start_date, end_date, is_enabled, legacy_budgets)
            VALUES (:id, :projectId, :phaseName, :phaseNumber, :startDate, :endDate, :enabled, :legacyBudgets)
            """, params);
        return phase;
    }

    @Override
    public Department insertDepartment(Department department) {
        var id = department.id().orElseGet(() -> UUID.randomUUID().toString());
        var params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("projectId", department.projectId())
            .addValue("phaseId", department.phaseId())
            .addValue("name", department.name())
            .addValue("contractorMode", department.contractorMode().label())
            .addValue("lineItems", json.write(department.lineItems()));
        jdbc.update("""
            INSERT INTO departments (id, project_id, phase_id, name, contractor_mode, line_items)
            VALUES (:id, :projectId, :phaseId, :name, :contractorMode, :lineItems)
            """, params);
        return department.withId(id);
    }

    @Override
    public int deletePhase(String projectId, String phaseId) {
        var params = new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("phaseId", phaseId);
        jdbc.update("DELETE FROM departments WHERE project_id = :projectId AND phase_id = :phaseId", params);
        return jdbc.update("DELETE FROM phases WHERE project_id = :projectId AND id = :phaseId", params);
    }

    @Override
    public void updatePhaseNumber(String projectId, String phaseId, int phaseNumber) {
        var params = new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("phaseId", phaseId)
            .addValue("phaseNumber", phaseNumber);
        jdbc.update("UPDATE phases SET phase_number = :phaseNumber WHERE project_id = :projectId AND id = :phaseId", params);
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private RowMapper<Phase> phaseRowMapper() {
        return (rs, rowNum) -> mapResultSetToPhase(rs);
    }

    private Phase mapResultSetToPhase(ResultSet rs) throws SQLException {
        // A missing flag means the phase predates the enable switch
        var enabledFlag = rs.getObject("IS_ENABLED", Integer.class);
        return new Phase(
            rs.getString("ID"),
            rs.getString("PROJECT_ID"),
            rs.getString("PHASE_NAME"),
            rs.getInt("PHASE_NUMBER"),
            StoreDates.parse(rs.getString("START_DATE")),
            StoreDates.parse(rs.getString("END_DATE")),
            enabledFlag == null || enabledFlag == 1,
            json.read(rs.getString("LEGACY_BUDGETS"), BUDGET_MAP, Map.of())
        );
    }

    private RowMapper<Department> departmentRowMapper() {
        return (rs, rowNum) -> new Department(
            Optional.ofNullable(rs.getString("ID")),
            rs.getString("PROJECT_ID"),
            rs.getString("PHASE_ID"),
            rs.getString("NAME"),
            ContractorMode.fromLabel(rs.getString("CONTRACTOR_MODE")),
            json.read(rs.getString("LINE_ITEMS"), LINE_ITEMS, List.of())
        );
    }
}
