package com.tracura.plm.service;

import com.tracura.plm.domain.Project;
import com.tracura.plm.domain.ProjectStatus;
import com.tracura.plm.domain.StatusTransition;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Automatic project status transitions. Decides only; writing is up to the caller.
 */
@Component
public class ProjectStatusEvaluator {

    /**
     * Phase-activity transition for a project, if one is due.
     * Suspended projects and statuses other than ACTIVE and STANDBY never move here.
     */
    public Optional<StatusTransition> evaluate(Project project, boolean hasActivePhase, LocalDate today) {
        if (project.suspended()) {
            return Optional.empty();
        }
        var current = project.statusType();
        return switch (current) {
            case ACTIVE -> hasActivePhase
                ? Optional.empty()
                : Optional.of(StatusTransition.of(project, ProjectStatus.STANDBY, "No active phase"));
            case STANDBY -> {
                if (!hasActivePhase) {
                    yield Optional.empty();
                }
                var handoverPassed = project.handoverDate().map(today::isAfter).orElse(false);
                yield handoverPassed
                    ? Optional.of(StatusTransition.of(project, ProjectStatus.MAINTENANCE,
                        "Phase active after handover"))
                    : Optional.of(StatusTransition.of(project, ProjectStatus.ACTIVE,
                        "Phase active"));
            }
            default -> Optional.empty();
        };
    }

    /**
     * Lift a suspension whose date is strictly before today.
     * The project resumes ACTIVE once its planned date is reached, LOCKED otherwise.
     */
    public Optional<StatusTransition> evaluateUnsuspend(Project project, LocalDate today) {
        if (!project.suspended()) {
            return Optional.empty();
        }
        var due = project.suspendedDate().map(d -> d.isBefore(today)).orElse(false);
        if (!due) {
            return Optional.empty();
        }
        var started = project.plannedDate().map(p -> !p.isAfter(today)).orElse(false);
        var target = started ? ProjectStatus.ACTIVE : ProjectStatus.LOCKED;
        return Optional.of(StatusTransition.unsuspend(project, target, "Suspension ended"));
    }
}
