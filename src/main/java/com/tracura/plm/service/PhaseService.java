package com.tracura.plm.service;

import com.tracura.plm.domain.Department;
import com.tracura.plm.domain.Phase;
import com.tracura.plm.domain.ValidationResult;
import com.tracura.plm.handler.ProjectChangePublisher;
import com.tracura.plm.repository.PhaseRepository;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase and department maintenance.
 */
@Service
public class PhaseService {

    private static final Logger log = LoggerFactory.getLogger(PhaseService.class);

    private final PhaseRepository phaseRepository;
    private final ProjectChangePublisher changePublisher;

    public PhaseService(PhaseRepository phaseRepository, ProjectChangePublisher changePublisher) {
        this.phaseRepository = phaseRepository;
        this.changePublisher = changePublisher;
    }

    /**
     * Add a department to a phase. Names are unique within the phase, ignoring case.
     */
    @Transactional
    public Either<ValidationResult, Department> addDepartment(String projectId, String phaseId, Department department) {
        if (phaseRepository.findPhase(projectId, phaseId).isEmpty()) {
            return Either.left(ValidationResult.error("PHASE_NOT_FOUND", "Phase not found", "phaseId"));
        }
        var duplicate = phaseRepository.findDepartments(projectId, phaseId).stream()
            .anyMatch(existing -> existing.hasSameName(department.name()));
        if (duplicate) {
            return Either.left(ValidationResult.error(
                "DUPLICATE_DEPARTMENT", "Department '" + department.name().trim() + "' already exists in this phase", "name"));
        }
        var saved = phaseRepository.insertDepartment(department);
        log.info("Added department {} to phase {} of project {}", saved.name(), phaseId, projectId);
        changePublisher.projectUpdated(projectId, "Department added");
        return Either.right(saved);
    }

    /**
     * Delete a phase and renumber the remaining phases 1..n, keeping their order.
     *
     * @return the remaining phases
     */
    @Transactional
    public Either<ValidationResult, List<Phase>> deletePhase(String projectId, String phaseId) {
        if (phaseRepository.deletePhase(projectId, phaseId) == 0) {
            return Either.left(ValidationResult.error("PHASE_NOT_FOUND", "Phase not found", "phaseId"));
        }
        var remaining = new ArrayList<Phase>();
        var phases = phaseRepository.findPhases(projectId);
        for (int i = 0; i < phases.size(); i++) {
            var phase = phases.get(i);
            var number = i + 1;
            if (phase.phaseNumber() != number) {
                phaseRepository.updatePhaseNumber(projectId, phase.id(), number);
                phase = phase.withPhaseNumber(number);
            }
            remaining.add(phase);
        }
        log.info("Deleted phase {} of project {}, {} phase(s) remain", phaseId, projectId, remaining.size());
        changePublisher.projectUpdated(projectId, "Phase deleted");
        return Either.right(remaining);
    }
}
