package com.tracura.plm.repository;

import com.tracura.plm.domain.Department;
import com.tracura.plm.domain.Phase;

import java.util.List;
import java.util.Optional;

/**
 * Phase and department documents of a project.
 */
public interface PhaseRepository {

    /**
     * Phases ordered by phase number.
     */
    List<Phase> findPhases(String projectId);

    Optional<Phase> findPhase(String projectId, String phaseId);

    List<Department> findDepartments(String projectId, String phaseId);

    Phase insertPhase(Phase phase);

    Department insertDepartment(Department department);

    /**
     * @return number of phases removed (0 or 1)
     */
    int deletePhase(String projectId, String phaseId);

    void updatePhaseNumber(String projectId, String phaseId, int phaseNumber);
}
